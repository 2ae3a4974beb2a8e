package org.gc.socialpublisher.domain.dto;

import lombok.Data;

@Data
public class AutoFillRequest {

    private Integer days;
}

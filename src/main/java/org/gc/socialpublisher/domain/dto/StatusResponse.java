package org.gc.socialpublisher.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    private String message;
    private String error;
    private Map<String, Object> details;

    public static StatusResponse success(String message) {
        return StatusResponse.builder()
                .message(message)
                .build();
    }

    public static StatusResponse failure(String error) {
        return StatusResponse.builder()
                .error(error)
                .build();
    }

    public static StatusResponse failure(String error, Map<String, Object> details) {
        return StatusResponse.builder()
                .error(error)
                .details(details)
                .build();
    }
}

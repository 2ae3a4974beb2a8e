package org.gc.socialpublisher.clients;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

/**
 * Instagram Graph API endpoints used for publishing and reconciliation.
 */
@FeignClient(name = "graph-api", url = "${publisher.platform.graph-base-url:https://graph.facebook.com/v21.0}")
public interface GraphApiClient {

    @RequestMapping(method = RequestMethod.GET, value = "/{mediaId}")
    Map<String, Object> getMedia(@PathVariable("mediaId") String mediaId,
                                 @RequestParam("fields") String fields,
                                 @RequestParam("access_token") String accessToken);

    @RequestMapping(method = RequestMethod.GET, value = "/{mediaId}/insights")
    Map<String, Object> getInsights(@PathVariable("mediaId") String mediaId,
                                    @RequestParam("metric") String metric,
                                    @RequestParam("access_token") String accessToken);

    @RequestMapping(method = RequestMethod.GET, value = "/{accountId}/media")
    Map<String, Object> listMedia(@PathVariable("accountId") String accountId,
                                  @RequestParam("fields") String fields,
                                  @RequestParam("limit") int limit,
                                  @RequestParam("access_token") String accessToken);

    @RequestMapping(method = RequestMethod.POST, value = "/{accountId}/media")
    Map<String, Object> createContainer(@PathVariable("accountId") String accountId,
                                        @RequestParam Map<String, String> params);

    @RequestMapping(method = RequestMethod.GET, value = "/{containerId}")
    Map<String, Object> getContainerStatus(@PathVariable("containerId") String containerId,
                                           @RequestParam("fields") String fields,
                                           @RequestParam("access_token") String accessToken);

    @RequestMapping(method = RequestMethod.POST, value = "/{accountId}/media_publish")
    Map<String, Object> publishContainer(@PathVariable("accountId") String accountId,
                                         @RequestParam("creation_id") String creationId,
                                         @RequestParam("access_token") String accessToken);
}

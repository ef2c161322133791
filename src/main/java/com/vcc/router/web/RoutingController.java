package com.vcc.router.web;

import com.vcc.router.dto.RouteRequest;
import com.vcc.router.dto.RouteResponse;
import com.vcc.router.engine.RoutingEngine;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class RoutingController {
    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final RoutingEngine routingEngine;

    public RoutingController(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    /**
     * Route one inference request.
     * POST /v1/route
     */
    @PostMapping(path = "/v1/route", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RouteResponse> route(@Valid @RequestBody RouteRequest request) {
        return routingEngine.route(request.toContext(), request.input())
                .map(RouteResponse::from)
                .doOnSuccess(r -> log.debug("Routed tenant={} app={} auditId={} model={}",
                        request.tenantId(), request.appId(), r.auditId(), r.finalModel()));
    }
}

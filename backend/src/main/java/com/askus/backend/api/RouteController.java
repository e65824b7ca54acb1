package com.askus.backend.api;

import com.askus.backend.routing.pipeline.RoutingPipeline;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RouteController {

    private final RoutingPipeline pipeline;

    public RouteController(RoutingPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/route")
    public RouteResponse route(@RequestBody RouteRequest body) {
        if (body == null || body.query() == null || body.query().isBlank()) {
            throw ApiException.badRequest("query is required");
        }
        return RouteResponse.from(pipeline.route(body.query(), body.routeHint()));
    }
}

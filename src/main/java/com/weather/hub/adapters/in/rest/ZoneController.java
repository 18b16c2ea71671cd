package com.weather.hub.adapters.in.rest;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.weather.hub.application.port.in.GetZonesUseCase;
import com.weather.hub.domain.entity.Zone;

/**
 * Zone catalog endpoint.
 * <p>
 * Usage: GET /zones?state=WA&amp;name=olympic
 * </p>
 */
@RestController
@RequestMapping("/zones")
public class ZoneController {

    private static final Logger log = LoggerFactory.getLogger(ZoneController.class);

    private final GetZonesUseCase getZonesUseCase;

    public ZoneController(GetZonesUseCase getZonesUseCase) {
        this.getZonesUseCase = getZonesUseCase;
    }

    @GetMapping
    public ResponseEntity<List<Zone>> getZones(
            @RequestParam(name = "state", required = false) String state,
            @RequestParam(name = "name", required = false) String name) {
        boolean filtered = (state != null && !state.isBlank()) || (name != null && !name.isBlank());
        List<Zone> zones = filtered
                ? getZonesUseCase.findZones(state, name)
                : getZonesUseCase.getZones();

        log.debug("action=zones_served count={} state={} name={}", zones.size(), state, name);
        return ResponseEntity.ok(zones);
    }
}

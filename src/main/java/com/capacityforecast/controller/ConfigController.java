package com.capacityforecast.controller;

import com.capacityforecast.config.ConfigStore;
import com.capacityforecast.config.PlannerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/config")
@RequiredArgsConstructor
public class ConfigController {

    private final ConfigStore configStore;

    @GetMapping
    public ResponseEntity<PlannerSettings> current() {
        return ResponseEntity.ok(configStore.current());
    }

    /** Invalid values are replaced by their defaults; the response lists each replacement. */
    @PutMapping
    public ResponseEntity<ConfigUpdateResponse> update(@RequestBody PlannerSettings settings) {
        List<String> warnings = configStore.update(settings);
        log.info("PUT /config | warnings={}", warnings.size());
        return ResponseEntity.ok(new ConfigUpdateResponse(configStore.current(), warnings));
    }

    @PostMapping("/reset")
    public ResponseEntity<PlannerSettings> reset() {
        log.info("POST /config/reset");
        return ResponseEntity.ok(configStore.reset());
    }

    public record ConfigUpdateResponse(PlannerSettings settings, List<String> warnings) {}
}

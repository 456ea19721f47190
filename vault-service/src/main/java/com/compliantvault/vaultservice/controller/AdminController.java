package com.compliantvault.vaultservice.controller;

import com.compliantvault.vaultservice.dto.SettingUpdateRequest;
import com.compliantvault.vaultservice.service.OracleSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/oracle")
@RequiredArgsConstructor
public class AdminController {

    private static final String CALLER = "X-User-ID";

    private final OracleSettingsService settingsService;

    @PutMapping("/source")
    public ResponseEntity<Void> updateSource(@RequestHeader(CALLER) String caller,
                                             @RequestBody @Valid SettingUpdateRequest request) {
        settingsService.updateSource(caller, request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/secrets")
    public ResponseEntity<Void> updateSecrets(@RequestHeader(CALLER) String caller,
                                              @RequestBody @Valid SettingUpdateRequest request) {
        settingsService.updateSecrets(caller, request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/subscription")
    public ResponseEntity<Void> updateSubscription(@RequestHeader(CALLER) String caller,
                                                   @RequestBody @Valid SettingUpdateRequest request) {
        settingsService.updateSubscriptionId(caller, Long.parseLong(request.value().strip()));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/endpoint")
    public ResponseEntity<Void> updateEndpoint(@RequestHeader(CALLER) String caller,
                                               @RequestBody @Valid SettingUpdateRequest request) {
        settingsService.updateDonId(caller, request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/gas-limit")
    public ResponseEntity<Void> updateGasLimit(@RequestHeader(CALLER) String caller,
                                               @RequestBody @Valid SettingUpdateRequest request) {
        settingsService.updateGasLimit(caller, Integer.parseInt(request.value().strip()));
        return ResponseEntity.noContent().build();
    }
}

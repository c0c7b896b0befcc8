package com.heronix.beacon.controller.api;

import java.security.Principal;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.beacon.service.AccountCleanupService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/dashboard/account")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Account", description = "Account data management")
public class AccountController {

    private final AccountCleanupService accountCleanupService;

    @DeleteMapping
    @Operation(summary = "Delete account data", description = "Delete all tokens, devices and network states of the current user")
    public ResponseEntity<Void> deleteAccount(Principal principal) {
        log.info("Account data deletion requested by {}", principal.getName());
        accountCleanupService.deleteAccountData(principal.getName());
        return ResponseEntity.noContent().build();
    }
}

package dao.fhe.mystery.controller;

import dao.fhe.mystery.model.CooldownRequest;
import dao.fhe.mystery.model.ProviderRequest;
import dao.fhe.mystery.service.AdminService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final AdminService adminService;

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    @PostMapping("/providers")
    public ResponseEntity<Map<String, Object>> addProvider(@RequestHeader(BatchController.CALLER_HEADER) String caller,
                                                           @Valid @RequestBody ProviderRequest req) {
        boolean added = adminService.addProvider(caller, req.getIdentity());
        return ResponseEntity.ok(Map.of("identity", req.getIdentity(), "added", added));
    }

    @DeleteMapping("/providers/{identity}")
    public ResponseEntity<Map<String, Object>> removeProvider(@RequestHeader(BatchController.CALLER_HEADER) String caller,
                                                              @PathVariable String identity) {
        boolean removed = adminService.removeProvider(caller, identity);
        return ResponseEntity.ok(Map.of("identity", identity, "removed", removed));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestHeader(BatchController.CALLER_HEADER) String caller) {
        adminService.pause(caller);
        return ResponseEntity.ok(Map.of("paused", true));
    }

    @PostMapping("/unpause")
    public ResponseEntity<Map<String, Object>> unpause(@RequestHeader(BatchController.CALLER_HEADER) String caller) {
        adminService.unpause(caller);
        return ResponseEntity.ok(Map.of("paused", false));
    }

    @PutMapping("/cooldown")
    public ResponseEntity<Map<String, Object>> setCooldown(@RequestHeader(BatchController.CALLER_HEADER) String caller,
                                                           @Valid @RequestBody CooldownRequest req) {
        adminService.setCooldown(caller, req.getCooldownSeconds());
        return ResponseEntity.ok(Map.of("cooldownSeconds", req.getCooldownSeconds()));
    }

    @PostMapping("/version-bump")
    public ResponseEntity<Map<String, Object>> bumpVersion(@RequestHeader(BatchController.CALLER_HEADER) String caller) {
        long version = adminService.bumpVersion(caller);
        return ResponseEntity.ok(Map.of("currentVersion", version));
    }
}

package com.platform.provisioner.api;

import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.ValidationException;
import com.platform.provisioner.model.Account;
import com.platform.provisioner.model.AccountSummary;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.remote.Session;
import com.platform.provisioner.service.ProvisioningService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for provisioning analytics accounts.
 */
@RestController
@RequestMapping("/api/v1")
public class ProvisioningController {
    
    private static final String BEARER_PREFIX = "Bearer ";
    
    private final ProvisioningService provisioningService;
    
    public ProvisioningController(ProvisioningService provisioningService) {
        this.provisioningService = provisioningService;
    }
    
    /**
     * Reconcile the described account and return the description with remote ids filled in.
     */
    @PostMapping("/provisioning")
    public Description provision(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(value = "X-Quota-User", required = false) String quotaUser,
            @RequestBody Description description) {
        return provisioningService.provision(session(authorization, quotaUser), description);
    }
    
    /**
     * Shape a loose description document without contacting the Management API.
     */
    @PostMapping("/descriptions")
    public Description shape(@RequestBody Map<String, Object> document) {
        return provisioningService.shape(document);
    }
    
    @GetMapping("/accounts")
    public List<Account> listAccounts(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(value = "X-Quota-User", required = false) String quotaUser) {
        return provisioningService.listAccounts(session(authorization, quotaUser));
    }
    
    @GetMapping("/account-summaries")
    public List<AccountSummary> listAccountSummaries(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(value = "X-Quota-User", required = false) String quotaUser) {
        return provisioningService.listAccountSummaries(session(authorization, quotaUser));
    }
    
    private static Session session(String authorization, String quotaUser) {
        if (!authorization.startsWith(BEARER_PREFIX) || authorization.length() == BEARER_PREFIX.length()) {
            throw new ValidationException(ErrorCode.UNAUTHORIZED, 401, "Bearer token required");
        }
        return new Session(authorization.substring(BEARER_PREFIX.length()).trim(), quotaUser);
    }
}

package com.sporehub.backend.auth.controller;

import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.security.AuthContext;
import com.sporehub.backend.common.web.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MeController {

    private final AuthContext auth;

    @GetMapping("/me")
    public ApiResponse<Identity> me() {
        return ApiResponse.ok("Authenticated", auth.requireIdentity());
    }
}

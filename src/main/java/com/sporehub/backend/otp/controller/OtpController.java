package com.sporehub.backend.otp.controller;

import com.sporehub.backend.common.web.ApiResponse;
import com.sporehub.backend.otp.OtpChallengeService;
import com.sporehub.backend.otp.OtpPurpose;
import com.sporehub.backend.otp.dto.OtpIssueRequest;
import com.sporehub.backend.otp.dto.OtpIssueResponse;
import com.sporehub.backend.otp.dto.OtpVerifyRequest;
import com.sporehub.backend.otp.dto.OtpVerifyResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Public OTP endpoints. Admission is applied by the guard filter for every path.
 */
@RestController
@RequestMapping("/v1/otp")
@RequiredArgsConstructor
public class OtpController {

    private final OtpChallengeService challenges;

    @PostMapping("/issue")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OtpIssueResponse> issue(@Valid @RequestBody OtpIssueRequest req) {
        return ApiResponse.ok("Code sent", start(req));
    }

    /** Sends a fresh code; the previous one stops working. */
    @PostMapping("/resend")
    public ApiResponse<OtpIssueResponse> resend(@Valid @RequestBody OtpIssueRequest req) {
        return ApiResponse.ok("Code sent", start(req));
    }

    @PostMapping("/verify")
    public ApiResponse<OtpVerifyResponse> verify(@Valid @RequestBody OtpVerifyRequest req) {
        OtpPurpose purpose = OtpPurpose.parse(req.purpose());
        return ApiResponse.ok("Code verified", challenges.verify(req.email(), purpose, req.code()));
    }

    private OtpIssueResponse start(OtpIssueRequest req) {
        OtpPurpose purpose = OtpPurpose.parse(req.purpose());
        if (req.hasTemplate()) {
            return challenges.startWithTemplate(req.email(), purpose, req.subject(), req.htmlTemplate(), req.textTemplate());
        }
        return challenges.start(req.email(), purpose);
    }
}

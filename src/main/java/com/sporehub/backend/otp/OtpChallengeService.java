package com.sporehub.backend.otp;

import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.token.IssuedToken;
import com.sporehub.backend.auth.token.TokenService;
import com.sporehub.backend.common.web.DeliveryFailedException;
import com.sporehub.backend.common.web.InvalidRequestException;
import com.sporehub.backend.common.web.NotFoundException;
import com.sporehub.backend.identity.IdentityDirectory;
import com.sporehub.backend.otp.dto.OtpIssueResponse;
import com.sporehub.backend.otp.dto.OtpVerifyResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Account rules around {@link OtpService} for the public OTP endpoints.
 * LOGIN and PASSWORD_RESET only go to known accounts; a verified LOGIN code is exchanged for an access token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OtpChallengeService {

    private final OtpService otp;
    private final IdentityDirectory directory;
    private final TokenService tokens;

    public OtpIssueResponse start(String email, OtpPurpose purpose) {
        requireAccountIfNeeded(email, purpose);
        return respond(otp.issue(email, purpose));
    }

    public OtpIssueResponse startWithTemplate(String email, OtpPurpose purpose, String subject,
                                              String htmlTemplate, String textTemplate) {
        requireAccountIfNeeded(email, purpose);
        return respond(otp.issueWithTemplate(email, purpose, subject, htmlTemplate, textTemplate));
    }

    public OtpVerifyResponse verify(String email, OtpPurpose purpose, String code) {
        // before verify: an unknown account must not consume the code
        Identity identity = null;
        if (purpose == OtpPurpose.LOGIN) {
            identity = directory.findByEmail(OtpService.normalizeEmail(email))
                    .orElseThrow(() -> new NotFoundException("Account not found"));
        }

        OtpVerificationResult result = otp.verify(email, purpose, code);
        switch (result) {
            case NOT_FOUND -> throw new NoActiveRecordException(purpose);
            case EXPIRED -> throw new InvalidRequestException("Code has expired. Request a new one.");
            case INVALID -> throw new InvalidRequestException("Invalid code");
            case VALID -> { }
        }

        if (identity == null) {
            return OtpVerifyResponse.verified(purpose);
        }
        IssuedToken token = tokens.issue(identity.subjectId(), identity.email(), identity.role());
        log.info("otp login succeeded subject={} role={}", identity.subjectId(), identity.role().wire());
        return OtpVerifyResponse.loggedIn(identity, token);
    }

    private void requireAccountIfNeeded(String email, OtpPurpose purpose) {
        if (purpose != OtpPurpose.LOGIN && purpose != OtpPurpose.PASSWORD_RESET) return;
        Optional<Identity> account = directory.findByEmail(OtpService.normalizeEmail(email));
        if (account.isEmpty()) {
            throw new NotFoundException("Account not found");
        }
    }

    private static OtpIssueResponse respond(OtpIssueResult issued) {
        if (!issued.delivered()) {
            // record stays active; the caller may request delivery again
            throw new DeliveryFailedException("email",
                    "Code was issued but could not be delivered (" + issued.delivery().name().toLowerCase()
                            + "). Please request it again.");
        }
        return OtpIssueResponse.from(issued.record());
    }
}

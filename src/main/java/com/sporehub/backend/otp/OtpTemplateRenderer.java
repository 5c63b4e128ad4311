package com.sporehub.backend.otp;

import com.sporehub.backend.common.web.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Plain placeholder substitution for OTP emails. No expressions are evaluated.
 * A caller template must contain {@value #CODE} and {@value #PURPOSE} exactly once each.
 */
@Component
@RequiredArgsConstructor
public class OtpTemplateRenderer {

    public static final String CODE = "{{code}}";
    public static final String PURPOSE = "{{purpose}}";

    private final OtpProperties props;

    public OtpMessage renderDefault(OtpPurpose purpose, String code, Duration ttl) {
        long minutes = Math.max(1, ttl.toMinutes());
        String app = escapeHtml(props.getAppName());

        String html = """
                <div style="font-family:Arial,sans-serif;max-width:480px;margin:auto">
                  <h2>%s</h2>
                  <p>Your {{purpose}} code is:</p>
                  <p style="font-size:28px;font-weight:bold;letter-spacing:6px">{{code}}</p>
                  <p>It expires in %d minutes. If you did not request it, ignore this email.</p>
                </div>
                """.formatted(app, minutes);
        String text = "Your {{purpose}} code is: {{code}}\nIt expires in " + minutes + " minutes.";
        String subject = props.getAppName() + " " + purpose.label() + " code";

        return new OtpMessage(subject, substitute(html, purpose, code), substitute(text, purpose, code));
    }

    /**
     * @param textTemplate may be null, a plain-text part is then derived from the defaults
     */
    public OtpMessage renderCustom(OtpPurpose purpose, String code, String subject,
                                   String htmlTemplate, String textTemplate) {
        if (subject == null || subject.isBlank()) throw new InvalidRequestException("subject is required");
        if (htmlTemplate == null || htmlTemplate.isBlank()) throw new InvalidRequestException("htmlTemplate is required");
        requirePlaceholders("htmlTemplate", htmlTemplate);

        String text;
        if (textTemplate == null || textTemplate.isBlank()) {
            text = substitute("Your {{purpose}} code is: {{code}}", purpose, code);
        } else {
            requirePlaceholders("textTemplate", textTemplate);
            text = substitute(textTemplate, purpose, code);
        }
        return new OtpMessage(subject.trim(), substitute(htmlTemplate, purpose, code), text);
    }

    static void requirePlaceholders(String name, String template) {
        int codes = occurrences(template, CODE);
        int purposes = occurrences(template, PURPOSE);
        if (codes != 1 || purposes != 1) {
            throw new InvalidRequestException(
                    name + " must contain " + CODE + " and " + PURPOSE + " exactly once each (found "
                            + codes + " and " + purposes + ")"
            );
        }
    }

    /** Single left-to-right pass, so substituted values are never rescanned. */
    static String substitute(String template, OtpPurpose purpose, String code) {
        StringBuilder out = new StringBuilder(template.length() + 16);
        int i = 0;
        while (i < template.length()) {
            if (template.startsWith(CODE, i)) {
                out.append(code);
                i += CODE.length();
            } else if (template.startsWith(PURPOSE, i)) {
                out.append(purpose.label());
                i += PURPOSE.length();
            } else {
                out.append(template.charAt(i++));
            }
        }
        return out.toString();
    }

    static int occurrences(String s, String needle) {
        int n = 0;
        int from = 0;
        while ((from = s.indexOf(needle, from)) >= 0) {
            n++;
            from += needle.length();
        }
        return n;
    }

    private static String escapeHtml(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}

package uk.gegc.interviewledger.shared.web;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import uk.gegc.interviewledger.shared.exception.ForbiddenException;
import uk.gegc.interviewledger.shared.exception.InvalidRequestException;
import uk.gegc.interviewledger.shared.security.CallerContext;
import uk.gegc.interviewledger.shared.security.CallerRole;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds a {@link CallerContext} controller argument from the gateway identity headers.
 */
@Component
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(MethodParameter parameter,
                                         ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest,
                                         WebDataBinderFactory binderFactory) {
        String callerId = webRequest.getHeader(CallerContext.CALLER_ID_HEADER);
        String roleHeader = webRequest.getHeader(CallerContext.ROLE_HEADER);
        if (callerId == null || roleHeader == null) {
            throw new ForbiddenException("Caller identity headers missing");
        }

        CallerRole role = parseRole(roleHeader);
        UUID orgId = parseUuid(webRequest.getHeader(CallerContext.ORG_ID_HEADER), CallerContext.ORG_ID_HEADER);
        if (orgId == null && role != CallerRole.SYSTEM) {
            throw new ForbiddenException("Tenant header missing");
        }
        return new CallerContext(parseUuid(callerId, CallerContext.CALLER_ID_HEADER), orgId, role);
    }

    private CallerRole parseRole(String value) {
        try {
            return CallerRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("Unknown caller role: " + value);
        }
    }

    private UUID parseUuid(String value, String header) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("Header " + header + " is not a valid UUID");
        }
    }
}

package co.fanki.qualityhub.auth.domain;

import co.fanki.qualityhub.user.domain.UserRole;

/**
 * The caller behind a request, as read from a verified access token.
 *
 * @param userId the user ID, the token subject
 * @param email the user e-mail
 * @param organizationId the user's organization
 * @param role the user's role
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AuthenticatedUser(
        String userId,
        String email,
        String organizationId,
        UserRole role
) {}

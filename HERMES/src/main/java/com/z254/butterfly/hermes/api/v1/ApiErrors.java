package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.communication.MessageValidator;
import com.z254.butterfly.hermes.delegation.SubAgentCoordinator;
import com.z254.butterfly.hermes.routing.MessageRouter;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps service exceptions to HTTP status codes for the v1 controllers.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static Throwable toResponseStatus(Throwable error) {
        HttpStatus status = statusOf(error);
        return status != null ? new ResponseStatusException(status, error.getMessage(), error) : error;
    }

    static HttpStatus statusOf(Throwable error) {
        if (error instanceof SubAgentCoordinator.AgentNotFoundException
                || error instanceof SubAgentCoordinator.TaskNotFoundException
                || error instanceof MessageRouter.RoutingException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof MessageValidator.InvalidMessageException
                || error instanceof SubAgentCoordinator.InvalidDelegationException
                || error instanceof SubAgentCoordinator.AgentValidationException
                || error instanceof CommunicationService.InvalidConfigurationException
                || error instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof CommunicationService.FeatureDisabledException
                || error instanceof MessageRouter.NoAvailableServerException
                || error instanceof IllegalStateException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return null;
    }
}

package com.nosota.mloan.adapter;

import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ExternalServiceException;
import com.nosota.mloan.port.Registry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Optional;

/**
 * {@link Registry} backed by the identity and asset registry service.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/v1/registry/identities/{identity}/verification</li>
 *   <li>GET /api/v1/registry/assets/{assetReference}/owner (404 when the asset has no owner)</li>
 * </ul>
 */
@Component
@Slf4j
public class RegistryClient implements Registry {

    private final WebClient webClient;

    public RegistryClient(@Qualifier("registryWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public boolean isVerified(String identity) throws ExternalServiceException {
        log.debug("Calling isVerified: identity={}", identity);

        Verification response;
        try {
            response = webClient.get()
                    .uri("/api/v1/registry/identities/{identity}/verification", identity)
                    .retrieve()
                    .bodyToMono(Verification.class)
                    .block();
        } catch (WebClientException e) {
            throw unavailable("isVerified", e);
        }
        return response != null && response.verified();
    }

    @Override
    public Optional<String> getAssetOwner(String assetReference) throws ExternalServiceException {
        log.debug("Calling getAssetOwner: assetReference={}", assetReference);

        try {
            AssetOwner response = webClient.get()
                    .uri("/api/v1/registry/assets/{assetReference}/owner", assetReference)
                    .retrieve()
                    .bodyToMono(AssetOwner.class)
                    .block();
            return Optional.ofNullable(response).map(AssetOwner::owner);
        } catch (WebClientResponseException.NotFound e) {
            return Optional.empty();
        } catch (WebClientException e) {
            throw unavailable("getAssetOwner", e);
        }
    }

    private ExternalServiceException unavailable(String operation, WebClientException e) {
        return new ExternalServiceException(ErrorCode.EXTERNAL_SERVICE_UNAVAILABLE,
                "Registry call " + operation + " failed: " + e.getMessage(), e);
    }

    record Verification(boolean verified) {
    }

    record AssetOwner(String owner) {
    }
}

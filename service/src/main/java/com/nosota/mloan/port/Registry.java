package com.nosota.mloan.port;

import com.nosota.mloan.error.ExternalServiceException;

import java.util.Optional;

/**
 * Identity verification and asset ownership lookups.
 */
public interface Registry {

    boolean isVerified(String identity) throws ExternalServiceException;

    Optional<String> getAssetOwner(String assetReference) throws ExternalServiceException;
}

package com.eyelevel.flambientprocessor.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param headers A mutable map of request headers. Implementations add or replace the entries
     *                their scheme requires.
     */
    void applyAuthentication(Map<String, String> headers);

    /**
     * @return {@code true} when the credentials needed by this scheme are present.
     */
    boolean isConfigured();
}

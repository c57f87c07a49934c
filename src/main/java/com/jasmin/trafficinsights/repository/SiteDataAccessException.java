package com.jasmin.trafficinsights.repository;

/**
 * The store could not be reached or refused an operation for a site.
 */
public class SiteDataAccessException extends RuntimeException {

    public SiteDataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.secops.riskengine.service;

import com.secops.riskengine.model.GeoLocation;

import java.util.Optional;

/**
 * IP geolocation capability. Lookups have no side effects and may fail
 * (empty result) for private or unregistered addresses.
 */
public interface GeoLocationService {

    Optional<GeoLocation> lookup(String ip);
}

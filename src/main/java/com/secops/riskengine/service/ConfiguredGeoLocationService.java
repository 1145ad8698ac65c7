package com.secops.riskengine.service;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.GeoLocation;
import com.secops.riskengine.util.IpAddresses;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Geolocation backed by the {@code risk.geo.locations} table. Keys are exact addresses
 * or prefixes ending in '.' or ':'; the longest matching prefix wins.
 */
@Service
public class ConfiguredGeoLocationService implements GeoLocationService {

    private final RiskDetectionConfig config;

    public ConfiguredGeoLocationService(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public Optional<GeoLocation> lookup(String ip) {
        if (!IpAddresses.isKnown(ip) || IpAddresses.isNonRoutable(ip)) {
            return Optional.empty();
        }
        String address = ip.trim();
        Map<String, RiskDetectionConfig.Location> locations = config.getGeo().getLocations();

        RiskDetectionConfig.Location exact = locations.get(address);
        if (exact != null) {
            return Optional.of(toGeoLocation(exact));
        }

        String bestPrefix = null;
        for (String key : locations.keySet()) {
            boolean isPrefix = key.endsWith(".") || key.endsWith(":");
            if (isPrefix && address.startsWith(key)
                    && (bestPrefix == null || key.length() > bestPrefix.length())) {
                bestPrefix = key;
            }
        }
        return Optional.ofNullable(bestPrefix).map(prefix -> toGeoLocation(locations.get(prefix)));
    }

    private static GeoLocation toGeoLocation(RiskDetectionConfig.Location location) {
        return new GeoLocation(location.getCountry(), location.getCity());
    }
}

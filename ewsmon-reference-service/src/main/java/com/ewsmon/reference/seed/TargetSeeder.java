package com.ewsmon.reference.seed;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Registers the standard Purolator production endpoints on start-up. Targets are matched by name only, so edited or
 * disabled rows are left alone and deleted ones come back on the next start.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ewsmon.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TargetSeeder {

    static final List<TargetSeed> DEFAULT_TARGETS = List.of(
            new TargetSeed(
                    "Purolator Shipping Service",
                    "https://webservices.purolator.com/EWS/v2/Shipping/ShippingService.asmx",
                    "http://purolator.com/pws/service/v2/ValidateShipment",
                    "validate"),
            new TargetSeed(
                    "Purolator Package Tracking Service",
                    "https://webservices.purolator.com/EWS/V1/Tracking/TrackingService.asmx",
                    "http://purolator.com/pws/service/v1/TrackPackagesByPin",
                    "track"),
            new TargetSeed(
                    "Purolator Locator Service",
                    "https://webservices.purolator.com/EWS/V1/Locator/LocatorService.asmx",
                    "http://purolator.com/pws/service/v1/GetLocationsByPostalCode",
                    "locate"),
            new TargetSeed(
                    "Purolator Estimate Service",
                    "https://webservices.purolator.com/EWS/V2/Estimating/EstimatingService.asmx",
                    "http://purolator.com/pws/service/v2/GetQuickEstimate",
                    "estimate"),
            new TargetSeed(
                    "Purolator Pickup Service",
                    "https://webservices.purolator.com/EWS/V1/PickUp/PickUpService.asmx",
                    "http://purolator.com/pws/service/v1/ValidatePickUp",
                    "pickup"),
            new TargetSeed(
                    "Purolator Service Availability Service",
                    "https://webservices.purolator.com/EWS/V2/ServiceAvailability/ServiceAvailabilityService.asmx",
                    "http://purolator.com/pws/service/v2/ValidateCityPostalCodeZip",
                    "sa"),
            new TargetSeed(
                    "Purolator Returns Management Service",
                    "https://webservices.purolator.com/EWS/V2/ReturnsManagement/ReturnsManagementService.asmx",
                    "http://purolator.com/pws/service/v2/ValidateReturnShipment",
                    "return"),
            new TargetSeed(
                    "Purolator Shipment Tracking Service",
                    "https://webservices.purolator.com/EWS/V2/ShipmentTracking/ShipmentTrackingService.asmx",
                    "http://purolator.com/pws/service/v2/TrackingByPinsOrReferences",
                    "shiptrack"));

    private final TargetSeedRepository repository;

    @PostConstruct
    public void seedDefaults() {
        seed(DEFAULT_TARGETS);
    }

    int seed(List<TargetSeed> seeds) {
        Set<String> existing = repository.existingNames();
        List<TargetSeed> missing =
                seeds.stream().filter(seed -> !existing.contains(seed.name())).toList();
        if (missing.isEmpty()) {
            log.debug("All {} default targets already present", seeds.size());
            return 0;
        }
        int created = repository.insert(missing);
        log.info("Seeded default targets created={} skipped={}", created, seeds.size() - missing.size());
        return created;
    }
}

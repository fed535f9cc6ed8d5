package dockhand.adapter.out.storage.memory;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import dockhand.core.port.out.PackageDirectory;

/**
 * In-memory map from tracking number to owning courier.
 */
@ApplicationScoped
public class InMemoryPackageDirectory implements PackageDirectory {

    private final ConcurrentHashMap<String, String> courierByTrackingNumber = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<String>> findCourierCode(String trackingNumber) {
        return Uni.createFrom().item(() -> Optional.ofNullable(courierByTrackingNumber.get(trackingNumber)));
    }

    public void register(String trackingNumber, String courierCode) {
        courierByTrackingNumber.put(trackingNumber, courierCode.toUpperCase(Locale.ROOT));
    }
}

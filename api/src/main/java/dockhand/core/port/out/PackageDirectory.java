package dockhand.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port to the package store, used only to learn which courier owns a package
 * before checking a partner key's scope.
 */
public interface PackageDirectory {

    /**
     * Look up the courier code owning a package.
     *
     * @param trackingNumber the package tracking number
     * @return Uni with the courier code, empty if the package is unknown
     */
    Uni<Optional<String>> findCourierCode(String trackingNumber);
}

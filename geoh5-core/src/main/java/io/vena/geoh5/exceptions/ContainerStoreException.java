package io.vena.geoh5.exceptions;

import io.vena.geoh5.store.ContainerStore;

/**
 * Wraps an {@link java.io.IOException} from a {@link ContainerStore}
 * when it surfaces from an accessor that can't declare checked exceptions,
 * such as a lazy read of octree cells.
 */
public class ContainerStoreException extends RuntimeException {
	public ContainerStoreException(String message) { super(message); }
	public ContainerStoreException(String message, Throwable cause) { super(message, cause); }
	public ContainerStoreException(Throwable cause) { super(cause); }
}

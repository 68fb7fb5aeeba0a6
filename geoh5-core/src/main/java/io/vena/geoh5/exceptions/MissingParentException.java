package io.vena.geoh5.exceptions;

/**
 * Indicates that the parent supplied for a new entity is not registered
 * in the workspace creating the entity.
 */
public class MissingParentException extends IllegalArgumentException {
	public MissingParentException(String message) { super(message); }
	public MissingParentException(String message, Throwable cause) { super(message, cause); }
	public MissingParentException(Throwable cause) { super(cause); }
}

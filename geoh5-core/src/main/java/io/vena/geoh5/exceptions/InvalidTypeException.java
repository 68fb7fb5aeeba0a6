package io.vena.geoh5.exceptions;

/**
 * Indicates that an entity type cannot be resolved, typically because
 * the entity class declares no stable type uid.
 */
public class InvalidTypeException extends IllegalArgumentException {
	public InvalidTypeException(String message) { super(message); }
	public InvalidTypeException(String message, Throwable cause) { super(message, cause); }
	public InvalidTypeException(Throwable cause) { super(cause); }
}

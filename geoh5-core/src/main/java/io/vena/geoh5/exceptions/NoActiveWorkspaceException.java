package io.vena.geoh5.exceptions;

public class NoActiveWorkspaceException extends IllegalStateException {
	public NoActiveWorkspaceException(String message) {
		super(message);
	}

	public NoActiveWorkspaceException(String message, Throwable cause) {
		super(message, cause);
	}
}

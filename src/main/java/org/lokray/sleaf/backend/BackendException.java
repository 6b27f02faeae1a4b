package org.lokray.sleaf.backend;

/**
 * Raised when an external backend stage (optimizer or native compiler) fails
 * or does not produce its artifact.
 */
public class BackendException extends Exception
{
	public BackendException(String message)
	{
		super(message);
	}

	public BackendException(String message, Throwable cause)
	{
		super(message, cause);
	}
}

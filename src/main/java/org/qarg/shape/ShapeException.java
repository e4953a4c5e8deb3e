package org.qarg.shape;

/**
 * Thrown while building a command shape that cannot be parsed unambiguously, e.g. when two options share a name. This is a programming
 * error in the declaration of the shape, not a condition to recover from at run time.
 */
public class ShapeException extends IllegalArgumentException {
	/** @param message The message for the exception */
	public ShapeException(String message) {
		super(message);
	}
}

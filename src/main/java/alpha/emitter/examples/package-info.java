/**
 * Runnable examples of how to use the library.
 */
package alpha.emitter.examples;

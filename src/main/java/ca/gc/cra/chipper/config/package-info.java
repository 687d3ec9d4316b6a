/**
 * Declarative logger configuration: definition records, the YAML loader and the factory that wires handlers to
 * concrete sinks.
 */
package ca.gc.cra.chipper.config;

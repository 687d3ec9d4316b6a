/**
 * Emission and trace value types passed from the logger to handlers.
 */
package ca.gc.cra.chipper.domain.emission;

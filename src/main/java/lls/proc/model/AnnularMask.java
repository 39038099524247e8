package lls.proc.model;

/**
 * Annular mask detected in the acquisition settings, described by its numerical apertures.
 */
public record AnnularMask(double outerNA, double innerNA) {
}

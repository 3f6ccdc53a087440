package edu.isi.hts;

public enum ModelDistributionType {
	NOT_DEFINED,
	CONTINUOUS,
	// multi-space: a voiced Gaussian plus an all-zero unvoiced one
	MSD
}

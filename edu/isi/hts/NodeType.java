package edu.isi.hts;

public enum NodeType {
	NON_LEAF,
	LEAF
}

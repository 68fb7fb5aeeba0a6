package io.vena.geoh5;

import lombok.Value;

/**
 * One cubic cell of an {@link Octree}: the base-grid indices of its origin
 * corner along u, v and w, and its edge length counted in base cells.
 */
@Value
public class OctreeCell {
	int i;
	int j;
	int k;
	int nCells;

	public OctreeCell(int i, int j, int k, int nCells) {
		if (nCells <= 0) {
			throw new IllegalArgumentException("Octree cell size must be positive; got " + nCells);
		}
		this.i = i;
		this.j = j;
		this.k = k;
		this.nCells = nCells;
	}

	@Override
	public String toString() {
		return "(" + i + ", " + j + ", " + k + ", " + nCells + ")";
	}
}

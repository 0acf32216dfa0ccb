/*-
 * #%L
 * Robust background phase correction for phase-contrast MRI
 * velocity data using polynomial MSAC fits.
 * %%
 * Copyright (C) 2021 - 2025 Phase Background Correction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.phasecorr.process.fit;

import java.util.Arrays;

/**
 * Flattened observations for background fitting. Each of the {@link #size()}
 * points has one target value per channel and a position in 2 or 3 spatial
 * dimensions. Instances are not modified after construction.
 */
public class PointSet
{
	private final int size;

	/**
	 * {@code targets[c][i]} is the value of channel {@code c} at point {@code i}.
	 */
	private final double[][] targets;

	/**
	 * {@code coordinates[d][i]} is the position of point {@code i} along axis {@code d}.
	 */
	private final double[][] coordinates;

	public PointSet( final double[][] targets, final double[][] coordinates )
	{
		this( copyOf( targets ), copyOf( coordinates ), true );
	}

	private PointSet( final double[][] targets, final double[][] coordinates, final boolean validate )
	{
		if ( validate )
		{
			if ( targets.length == 0 )
				throw new IllegalArgumentException( "There must be at least one target channel." );
			if ( coordinates.length == 0 )
				throw new IllegalArgumentException( "There must be at least one spatial dimension." );

			final int n = targets[ 0 ].length;
			for ( final double[] t : targets )
				if ( t.length != n )
					throw new DimensionMismatchException( "All target channels must have the same number of points." );
			for ( final double[] p : coordinates )
				if ( p.length != n )
					throw new DimensionMismatchException( "Coordinates and targets must have the same number of points." );
		}
		this.targets = targets;
		this.coordinates = coordinates;
		this.size = targets[ 0 ].length;
	}

	public int size()
	{
		return size;
	}

	public int numChannels()
	{
		return targets.length;
	}

	public int numSpatialDimensions()
	{
		return coordinates.length;
	}

	/**
	 * Get the internal target arrays. Must not be modified.
	 *
	 * @return {@code targets[channel][point]}
	 */
	public double[][] targets()
	{
		return targets;
	}

	/**
	 * Get the internal coordinate arrays. Must not be modified.
	 *
	 * @return {@code coordinates[dimension][point]}
	 */
	public double[][] coordinates()
	{
		return coordinates;
	}

	/**
	 * @return whether all targets and coordinates are finite
	 */
	public boolean isFinite()
	{
		return allFinite( targets ) && allFinite( coordinates );
	}

	/**
	 * Create a new {@code PointSet} holding the points at the selected indices.
	 *
	 * @param indices the points to select
	 * @return selected points in the order of {@code indices}
	 */
	public PointSet select( final PointIndices indices )
	{
		final int n = indices.size();
		final double[][] selectedTargets = new double[ targets.length ][ n ];
		for ( int c = 0; c < targets.length; ++c )
			indices.copySelected( targets[ c ], selectedTargets[ c ] );

		final double[][] selectedCoordinates = new double[ coordinates.length ][ n ];
		for ( int d = 0; d < coordinates.length; ++d )
			indices.copySelected( coordinates[ d ], selectedCoordinates[ d ] );

		return new PointSet( selectedTargets, selectedCoordinates, false );
	}

	private static double[][] copyOf( final double[][] arrays )
	{
		final double[][] copy = new double[ arrays.length ][];
		Arrays.setAll( copy, i -> arrays[ i ].clone() );
		return copy;
	}

	private static boolean allFinite( final double[][] arrays )
	{
		for ( final double[] array : arrays )
			for ( final double v : array )
				if ( !Double.isFinite( v ) )
					return false;
		return true;
	}
}

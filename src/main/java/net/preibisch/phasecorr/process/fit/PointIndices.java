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

import java.util.Random;

/**
 * Index list into a {@link PointSet}, used for drawing random samples.
 */
public class PointIndices
{
	private final int[] indices;

	private int size;

	public PointIndices( final int capacity )
	{
		indices = new int[ capacity ];
		size = 0;
	}

	public int capacity()
	{
		return indices.length;
	}

	public int size()
	{
		return size;
	}

	/**
	 * Get the internal index array.
	 * <p>
	 * Note that the length of the returned array may be larger than the current {@code size()} of this {@code PointIndices}.
	 *
	 * @return index array
	 */
	public int[] indices()
	{
		return indices;
	}

	/**
	 * Fill to capacity with distinct indices drawn uniformly from
	 * {@code [0, bound)}.
	 *
	 * @param rnd source of randomness
	 * @param bound number of candidate points
	 */
	public void sample( final Random rnd, final int bound )
	{
		distinctRandomInts( rnd, bound, indices );
		size = indices.length;
	}

	public void copySelected( final double[] src, final double[] dest )
	{
		for ( int i = 0; i < size; i++ )
			dest[ i ] = src[ indices[ i ] ];
	}

	private static void distinctRandomInts( final Random rnd, final int bound, final int[] ints )
	{
		if ( ints.length > bound )
			throw new IllegalArgumentException( "not enough candidates" );

		for ( int count = 0; count < ints.length; )
		{
			final int value = rnd.nextInt( bound );
			if ( !contains( ints, count, value ) )
				ints[ count++ ] = value;
		}
	}

	private static boolean contains( final int[] ints, final int bound, final int value )
	{
		for ( int i = 0; i < bound; i++ )
			if ( ints[ i ] == value )
				return true;
		return false;
	}
}

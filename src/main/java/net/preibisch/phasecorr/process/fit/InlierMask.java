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
 * Per-channel membership of points in a consensus set.
 */
public class InlierMask
{
	private final boolean[][] inliers;

	/**
	 * Create an empty mask (no inliers).
	 *
	 * @param numChannels number of channels
	 * @param size number of points
	 */
	public InlierMask( final int numChannels, final int size )
	{
		inliers = new boolean[ numChannels ][ size ];
	}

	/**
	 * @return a mask selecting every point in every channel
	 */
	public static InlierMask all( final int numChannels, final int size )
	{
		final InlierMask mask = new InlierMask( numChannels, size );
		for ( final boolean[] channel : mask.inliers )
			Arrays.fill( channel, true );
		return mask;
	}

	public int numChannels()
	{
		return inliers.length;
	}

	public int size()
	{
		return inliers[ 0 ].length;
	}

	public boolean isInlier( final int channel, final int i )
	{
		return inliers[ channel ][ i ];
	}

	public void set( final int channel, final int i, final boolean inlier )
	{
		inliers[ channel ][ i ] = inlier;
	}

	/**
	 * Replace the mask of one channel.
	 */
	public void set( final int channel, final InlierMask other )
	{
		System.arraycopy( other.inliers[ channel ], 0, inliers[ channel ], 0, inliers[ channel ].length );
	}

	public int count( final int channel )
	{
		int n = 0;
		for ( final boolean b : inliers[ channel ] )
			if ( b )
				++n;
		return n;
	}
}

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

/**
 * Acquisition type of the phase-contrast data. 2d flow has a single
 * through-plane velocity channel sampled on an image, 4d flow has three
 * velocity channels sampled on a volume.
 */
public enum FlowEncoding
{
	FLOW_2D( 1, 2 ),
	FLOW_4D( 3, 3 );

	private final int numChannels;

	private final int numSpatialDimensions;

	FlowEncoding( final int numChannels, final int numSpatialDimensions )
	{
		this.numChannels = numChannels;
		this.numSpatialDimensions = numSpatialDimensions;
	}

	/**
	 * @return number of flow encoding directions
	 */
	public int numChannels()
	{
		return numChannels;
	}

	public int numSpatialDimensions()
	{
		return numSpatialDimensions;
	}

	public static FlowEncoding fromFlowDimensions( final int flowDimensions )
	{
		for ( final FlowEncoding encoding : values() )
			if ( encoding.numChannels == flowDimensions )
				return encoding;

		throw new InvalidConfigurationException( "Number of flow dimensions must be 1 (2d flow) or 3 (4d flow), but was " + flowDimensions + "." );
	}
}

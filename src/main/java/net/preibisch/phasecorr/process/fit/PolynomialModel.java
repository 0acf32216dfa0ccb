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
 * Coefficients of a polynomial background, one coefficient vector per
 * channel. Coefficient {@code k} multiplies column {@code k} of the
 * {@link PolynomialBasis} of the same order and dimensionality.
 */
public class PolynomialModel
{
	private final PolynomialOrder order;

	private final int numSpatialDimensions;

	private final double[][] coefficients;

	public PolynomialModel( final PolynomialOrder order, final int numSpatialDimensions, final double[][] coefficients )
	{
		final int numCoefficients = order.numCoefficients( numSpatialDimensions );
		for ( final double[] c : coefficients )
			if ( c.length != numCoefficients )
				throw new IllegalArgumentException( "Order " + order.degree() + " in " + numSpatialDimensions + "d requires " + numCoefficients + " coefficients per channel, got " + c.length + "." );

		this.order = order;
		this.numSpatialDimensions = numSpatialDimensions;
		this.coefficients = new double[ coefficients.length ][];
		Arrays.setAll( this.coefficients, c -> coefficients[ c ].clone() );
	}

	public PolynomialOrder order()
	{
		return order;
	}

	public int numSpatialDimensions()
	{
		return numSpatialDimensions;
	}

	public int numChannels()
	{
		return coefficients.length;
	}

	public int numCoefficients()
	{
		return coefficients[ 0 ].length;
	}

	/**
	 * @param channel channel index
	 * @return a copy of the coefficients of {@code channel}
	 */
	public double[] coefficients( final int channel )
	{
		return coefficients[ channel ].clone();
	}

	double[] coefficientsRef( final int channel )
	{
		return coefficients[ channel ];
	}

	@Override
	public String toString()
	{
		return "PolynomialModel{" +
				"order=" + order.degree() +
				", dimensions=" + numSpatialDimensions +
				", coefficients=" + Arrays.deepToString( coefficients ) +
				'}';
	}
}

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
 * Total degree of a background polynomial.
 */
public enum PolynomialOrder
{
	CONSTANT( 0 ),
	LINEAR( 1 ),
	QUADRATIC( 2 ),
	CUBIC( 3 );

	private final int degree;

	PolynomialOrder( final int degree )
	{
		this.degree = degree;
	}

	public int degree()
	{
		return degree;
	}

	/**
	 * Number of monomials up to this degree, i.e. the number of columns of the
	 * design matrix and the minimal number of data points for a fit.
	 *
	 * @param numSpatialDimensions 2 or 3
	 * @return 1, 3, 6, 10 (2d) or 1, 4, 10, 20 (3d)
	 */
	public int numCoefficients( final int numSpatialDimensions )
	{
		final int d = degree;
		switch ( numSpatialDimensions )
		{
		case 2:
			return ( d + 1 ) * ( d + 2 ) / 2;
		case 3:
			return ( d + 1 ) * ( d + 2 ) * ( d + 3 ) / 6;
		default:
			throw new InvalidConfigurationException( "Polynomial backgrounds are defined for 2 or 3 spatial dimensions, not " + numSpatialDimensions + "." );
		}
	}

	public static PolynomialOrder fromDegree( final int degree )
	{
		for ( final PolynomialOrder order : values() )
			if ( order.degree == degree )
				return order;

		throw new InvalidConfigurationException( "Polynomial order must be 0, 1, 2 or 3, but was " + degree + "." );
	}
}

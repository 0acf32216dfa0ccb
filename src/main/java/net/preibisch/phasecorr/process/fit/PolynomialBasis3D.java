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
 * Monomials up to degree 3 in (p1, p2, p3):
 * <pre>
 * 1, p1, p2, p3,
 * p1², p1 p2, p1 p3, p2², p2 p3, p3²,
 * p1³, p1² p2, p1² p3, p2³, p2² p1, p2² p3, p3³, p3² p1, p3² p2, p1 p2 p3
 * </pre>
 */
public class PolynomialBasis3D implements PolynomialBasis
{
	private final PolynomialOrder order;

	private final int numCoefficients;

	public PolynomialBasis3D( final PolynomialOrder order )
	{
		this.order = order;
		this.numCoefficients = order.numCoefficients( 3 );
	}

	@Override
	public PolynomialOrder order()
	{
		return order;
	}

	@Override
	public int numSpatialDimensions()
	{
		return 3;
	}

	@Override
	public int numCoefficients()
	{
		return numCoefficients;
	}

	@Override
	public void features( final double[][] coordinates, final int i, final double[] row )
	{
		final int degree = order.degree();
		final double p1 = coordinates[ 0 ][ i ];
		final double p2 = coordinates[ 1 ][ i ];
		final double p3 = coordinates[ 2 ][ i ];

		row[ 0 ] = 1;
		if ( degree >= 1 )
		{
			row[ 1 ] = p1;
			row[ 2 ] = p2;
			row[ 3 ] = p3;
		}
		if ( degree >= 2 )
		{
			row[ 4 ] = p1 * p1;
			row[ 5 ] = p1 * p2;
			row[ 6 ] = p1 * p3;
			row[ 7 ] = p2 * p2;
			row[ 8 ] = p2 * p3;
			row[ 9 ] = p3 * p3;
		}
		if ( degree >= 3 )
		{
			row[ 10 ] = p1 * p1 * p1;
			row[ 11 ] = p1 * p1 * p2;
			row[ 12 ] = p1 * p1 * p3;
			row[ 13 ] = p2 * p2 * p2;
			row[ 14 ] = p2 * p2 * p1;
			row[ 15 ] = p2 * p2 * p3;
			row[ 16 ] = p3 * p3 * p3;
			row[ 17 ] = p3 * p3 * p1;
			row[ 18 ] = p3 * p3 * p2;
			row[ 19 ] = p1 * p2 * p3;
		}
	}
}

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
 * N x K matrix of polynomial features of a {@link PointSet}.
 */
public class DesignMatrix
{
	private final PolynomialBasis basis;

	private final double[][] rows;

	private DesignMatrix( final PolynomialBasis basis, final double[][] rows )
	{
		this.basis = basis;
		this.rows = rows;
	}

	public static DesignMatrix create( final PolynomialBasis basis, final PointSet points )
	{
		if ( points.numSpatialDimensions() != basis.numSpatialDimensions() )
			throw new DimensionMismatchException( "Points have " + points.numSpatialDimensions() + " spatial dimensions, the polynomial basis expects " + basis.numSpatialDimensions() + "." );

		final double[][] coordinates = points.coordinates();
		final double[][] rows = new double[ points.size() ][ basis.numCoefficients() ];
		for ( int i = 0; i < rows.length; ++i )
			basis.features( coordinates, i, rows[ i ] );

		return new DesignMatrix( basis, rows );
	}

	public PolynomialBasis basis()
	{
		return basis;
	}

	public int numRows()
	{
		return rows.length;
	}

	public int numColumns()
	{
		return basis.numCoefficients();
	}

	/**
	 * Get the internal row array. Must not be modified.
	 *
	 * @param i row index
	 * @return features of point {@code i}
	 */
	public double[] row( final int i )
	{
		return rows[ i ];
	}

	/**
	 * @param coefficients one coefficient per column
	 * @return the product of this matrix with {@code coefficients}
	 */
	public double[] multiply( final double[] coefficients )
	{
		final int numColumns = numColumns();
		if ( coefficients.length != numColumns )
			throw new IllegalArgumentException( "Expected " + numColumns + " coefficients, got " + coefficients.length + "." );

		final double[] result = new double[ rows.length ];
		for ( int i = 0; i < rows.length; ++i )
		{
			final double[] row = rows[ i ];
			double sum = 0;
			for ( int k = 0; k < numColumns; ++k )
				sum += row[ k ] * coefficients[ k ];
			result[ i ] = sum;
		}
		return result;
	}
}

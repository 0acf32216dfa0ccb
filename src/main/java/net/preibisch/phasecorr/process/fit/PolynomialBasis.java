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
 * Monomial basis of a polynomial in 2 or 3 spatial variables. The column
 * order of the features is fixed for a given order and dimensionality, so
 * coefficients estimated with one design matrix can be applied to another.
 */
public interface PolynomialBasis
{
	PolynomialOrder order();

	int numSpatialDimensions();

	/**
	 * @return number of features per point, i.e. columns of the design matrix
	 */
	int numCoefficients();

	/**
	 * Write the features of point {@code i} into {@code row}.
	 *
	 * @param coordinates flattened coordinates, {@code coordinates[d][i]}
	 * @param i index of the point
	 * @param row receives {@link #numCoefficients()} features
	 */
	void features( final double[][] coordinates, final int i, final double[] row );

	static PolynomialBasis create( final PolynomialOrder order, final int numSpatialDimensions )
	{
		switch ( numSpatialDimensions )
		{
		case 2:
			return new PolynomialBasis2D( order );
		case 3:
			return new PolynomialBasis3D( order );
		default:
			throw new InvalidConfigurationException( "Polynomial backgrounds are defined for 2 or 3 spatial dimensions, not " + numSpatialDimensions + "." );
		}
	}
}

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
 * Fit, evaluate and score a background model for a fixed flow encoding and
 * polynomial order.
 */
public interface BackgroundFit
{
	FlowEncoding encoding();

	PolynomialOrder order();

	/**
	 * @return the minimal number of points required by {@link #fit(PointSet)}
	 */
	int getMinNumPoints();

	DesignMatrix designMatrix( final PointSet points );

	/**
	 * Fit to all points.
	 *
	 * @throws FitException if not enough points or a singular system
	 */
	PolynomialModel fit( final PointSet points ) throws FitException;

	/**
	 * Fit every channel to the points selected for that channel.
	 *
	 * @throws FitException if a channel selects too few points or a singular system
	 */
	PolynomialModel fit( final PointSet points, final InlierMask inliers ) throws FitException;

	/**
	 * @return predicted targets, {@code [channel][point]}
	 */
	double[][] evaluate( final PolynomialModel model, final PointSet points );

	double[][] evaluate( final PolynomialModel model, final DesignMatrix design );

	/**
	 * Half the absolute difference between targets and predictions.
	 *
	 * @return residual distances, {@code [channel][point]}
	 */
	double[][] distance( final PolynomialModel model, final PointSet points );

	double[][] distance( final PolynomialModel model, final PointSet points, final DesignMatrix design );
}

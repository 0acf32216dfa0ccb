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
 * Fewer data points were selected than the polynomial has coefficients.
 */
public class InsufficientSamplesException extends FitException
{
	private static final long serialVersionUID = 4408261203378145386L;

	private final int numPoints;

	private final int numRequired;

	public InsufficientSamplesException( final int numPoints, final int numRequired )
	{
		super( numPoints + " data points are not enough to estimate the model, at least " + numRequired + " data points required." );
		this.numPoints = numPoints;
		this.numRequired = numRequired;
	}

	public int getNumPoints()
	{
		return numPoints;
	}

	public int getNumRequired()
	{
		return numRequired;
	}
}

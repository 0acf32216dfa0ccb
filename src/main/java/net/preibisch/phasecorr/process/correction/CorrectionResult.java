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
package net.preibisch.phasecorr.process.correction;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.phasecorr.process.fit.InlierMask;
import net.preibisch.phasecorr.process.fit.PolynomialModel;
import net.preibisch.phasecorr.process.msac.MsacResult;

/**
 * Images and diagnostics of a {@link BackgroundPhaseCorrection} run.
 * <p>
 * Image axes are {@code [dim1, dim2, slice]} for the magnitude mask,
 * {@code [dim1, dim2, slice, channel]} for time-averaged fields and
 * {@code [dim1, dim2, slice, time, channel]} for the time-resolved field.
 */
public class CorrectionResult
{
	private final ArrayImg< BitType, LongArray > magnitudeMask;
	private final ArrayImg< BitType, LongArray > msacMask;
	private final MsacResult msac;
	private final PolynomialModel model;
	private final ArrayImg< DoubleType, DoubleArray > background;
	private final ArrayImg< DoubleType, DoubleArray > correctedAverage;
	private final ArrayImg< DoubleType, DoubleArray > correctedTimeResolved;
	private final long timeMsac;
	private final long timeTotal;

	CorrectionResult(
			final ArrayImg< BitType, LongArray > magnitudeMask,
			final ArrayImg< BitType, LongArray > msacMask,
			final MsacResult msac,
			final PolynomialModel model,
			final ArrayImg< DoubleType, DoubleArray > background,
			final ArrayImg< DoubleType, DoubleArray > correctedAverage,
			final ArrayImg< DoubleType, DoubleArray > correctedTimeResolved,
			final long timeMsac,
			final long timeTotal )
	{
		this.magnitudeMask = magnitudeMask;
		this.msacMask = msacMask;
		this.msac = msac;
		this.model = model;
		this.background = background;
		this.correctedAverage = correctedAverage;
		this.correctedTimeResolved = correctedTimeResolved;
		this.timeMsac = timeMsac;
		this.timeTotal = timeTotal;
	}

	/**
	 * @return pixels whose time-averaged magnitude exceeds the threshold
	 */
	public ArrayImg< BitType, LongArray > magnitudeMask()
	{
		return magnitudeMask;
	}

	/**
	 * @return stationary tissue per channel as found by MSAC
	 */
	public ArrayImg< BitType, LongArray > msacMask()
	{
		return msacMask;
	}

	/**
	 * @return MSAC inliers in the order of the magnitude mask points
	 */
	public InlierMask inliers()
	{
		return msac.inliers();
	}

	public MsacResult msac()
	{
		return msac;
	}

	/**
	 * @return correction model fitted to the MSAC inliers
	 */
	public PolynomialModel model()
	{
		return model;
	}

	/**
	 * @return background phase estimated for every pixel
	 */
	public ArrayImg< DoubleType, DoubleArray > background()
	{
		return background;
	}

	public ArrayImg< DoubleType, DoubleArray > correctedAverage()
	{
		return correctedAverage;
	}

	public ArrayImg< DoubleType, DoubleArray > correctedTimeResolved()
	{
		return correctedTimeResolved;
	}

	/**
	 * @return time spent in MSAC in milliseconds
	 */
	public long timeMsac()
	{
		return timeMsac;
	}

	/**
	 * @return time of the complete run in milliseconds
	 */
	public long timeTotal()
	{
		return timeTotal;
	}
}

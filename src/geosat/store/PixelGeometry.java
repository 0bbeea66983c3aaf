package geosat.store;

import geosat.proj.GeoConst;

/**
 * Quantities derived from the resolution of an image and the orbit of the
 * satellite that took it. Nothing is cached, every call recomputes.
 * @author Federal Highway Administration
 */
public abstract class PixelGeometry
{
	/**
	 * Gets the ground size of one pixel at the sub-satellite point
	 * @param oImage the image
	 * @return pixel size in km
	 */
	public static double pixelSize(Image oImage)
	{
		double dHeight = oImage.m_oProj.getOrbitRadius() - GeoConst.EARTH_RADIUS_EQ; // satellite height above the equator
		return dHeight * Math.tan((1.0 / oImage.m_dColumnRes) * GeoConst.PIOVER180);
	}


	/**
	 * Gets the number of pixels spanned by the earth disk across the equator,
	 * the SEVIRI sampling constant.
	 * @param oImage the image
	 * @return the sampling distance, rounded to a whole number of pixels
	 */
	public static double seviriDX(Image oImage)
	{
		double dOrbit = oImage.m_oProj.getOrbitRadius();
		double dHeight = dOrbit - GeoConst.EARTH_RADIUS_EQ;
		return Math.round((2.0 * Math.asin(GeoConst.EARTH_RADIUS_EQ / dOrbit)) / Math.atan(pixelSize(oImage) / dHeight));
	}


	/**
	 * Pixels are square so this is the same as {@link #seviriDX(Image)}
	 * @param oImage the image
	 * @return the sampling distance along the lines
	 */
	public static double seviriDY(Image oImage)
	{
		return seviriDX(oImage);
	}
}

/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package geosat.proj;

/**
 * Normalized geostationary projection used by full-disk images. Converts
 * lon/lat to the view angles seen from the satellite and back following
 * par. 4.4 of the LRIT/HRIT Global Specification (CGMS 03 Issue 2.6).
 * <p>
 * Projected x grows eastward and projected y grows southward, both in degrees
 * of view angle from the sub-satellite point.
 * </p>
 * @author aaron.cherney
 */
public class Geos extends Projection
{
	/**
	 * Longitude of the sub-satellite point in decimal degrees
	 */
	private final double m_dSubLon;


	/**
	 * Distance from the center of the earth to the satellite in km
	 */
	private final double m_dOrbitRadius;


	/**
	 * orbit radius^2 - equatorial radius^2, the constant term of the line of
	 * sight/ellipsoid intersection
	 */
	private final double m_dRangeConst;


	/**
	 * Smallest x component (km, earth centered) a surface point can have and
	 * still be above the horizon of the satellite
	 */
	private final double m_dHorizonX;


	/**
	 * Wrapper for {@link Geos#Geos(double, double)} with the nominal
	 * geostationary orbit radius
	 * @param dSubLon sub-satellite longitude in decimal degrees
	 */
	public Geos(double dSubLon)
	{
		this(dSubLon, GeoConst.ORBIT_RADIUS);
	}


	/**
	 * Constructs a Geos projection for a satellite at the given longitude and
	 * distance from the center of the earth
	 * @param dSubLon sub-satellite longitude in decimal degrees
	 * @param dOrbitRadius distance from the center of the earth in km
	 * @throws IllegalArgumentException if the orbit is not outside of the earth
	 */
	public Geos(double dSubLon, double dOrbitRadius)
	{
		if (!Double.isFinite(dSubLon))
			throw new IllegalArgumentException("Sub-satellite longitude must be finite");
		if (!Double.isFinite(dOrbitRadius) || dOrbitRadius <= GeoConst.EARTH_RADIUS_EQ)
			throw new IllegalArgumentException(String.format("Orbit radius %f km must be greater than the equatorial radius", dOrbitRadius));
		m_dSubLon = dSubLon;
		m_dOrbitRadius = dOrbitRadius;
		m_dRangeConst = dOrbitRadius * dOrbitRadius - GeoConst.EARTH_RADIUS_EQ * GeoConst.EARTH_RADIUS_EQ;
		m_dHorizonX = GeoConst.EARTH_RADIUS_EQ * GeoConst.EARTH_RADIUS_EQ / dOrbitRadius;
	}


	public double getSubLon()
	{
		return m_dSubLon;
	}


	public double getOrbitRadius()
	{
		return m_dOrbitRadius;
	}


	@Override
	public ProjectedPoint mapToProjected(MapPoint oMap)
	{
		double dLat = oMap.m_dLat * GeoConst.PIOVER180;
		double dLon = (oMap.m_dLon - m_dSubLon) * GeoConst.PIOVER180;

		double dCLat = Math.atan(GeoConst.EARTH_1E2 * Math.tan(dLat)); // geocentric latitude
		double dCosCLat = Math.cos(dCLat);
		double dRl = GeoConst.EARTH_RADIUS_POL / Math.sqrt(1.0 - GeoConst.EARTH_E2 * dCosCLat * dCosCLat); // distance from the center of the earth to the surface

		double dPx = dRl * dCosCLat * Math.cos(dLon);
		double dR1 = m_dOrbitRadius - dPx;
		double dR2 = -dRl * dCosCLat * Math.sin(dLon);
		double dR3 = dRl * Math.sin(dCLat);
		double dRn = Math.sqrt(dR1 * dR1 + dR2 * dR2 + dR3 * dR3);

		if (dR1 <= 0.0 || !(dPx > m_dHorizonX)) // the point is on the far side of the earth
			throw new InvalidGeometryException(String.format("Point %s is not visible from %s", oMap, format()));

		double dX = Math.atan(-dR2 / dR1) * GeoConst.DEGPERRAD;
		double dY = Math.asin(-dR3 / dRn) * GeoConst.DEGPERRAD;
		if (!Double.isFinite(dX) || !Double.isFinite(dY))
			throw new InvalidGeometryException(String.format("Point %s has no projection in %s", oMap, format()));

		return new ProjectedPoint(dX, dY);
	}


	@Override
	public MapPoint projectedToMap(ProjectedPoint oProj)
	{
		if (!(Math.abs(oProj.m_dX) < 90.0) || !(Math.abs(oProj.m_dY) < 90.0))
			throw new InvalidGeometryException(String.format("View angle %s is out of range", oProj));

		double dX = oProj.m_dX * GeoConst.PIOVER180;
		double dY = oProj.m_dY * GeoConst.PIOVER180;
		double dCosX = Math.cos(dX);
		double dCosY = Math.cos(dY);
		double dSinY = Math.sin(dY);

		double dA = m_dOrbitRadius * dCosX * dCosY;
		double dB = dCosY * dCosY + GeoConst.EARTH_IE2 * dSinY * dSinY;
		double dDisc = dA * dA - dB * m_dRangeConst;
		if (dDisc < 0.0) // the line of sight misses the earth
			throw new InvalidGeometryException(String.format("View angle %s is outside of the earth disk", oProj));

		double dSn = (dA - Math.sqrt(dDisc)) / dB; // distance from the satellite to the surface
		if (!(dSn > 0.0))
			throw new InvalidGeometryException(String.format("View angle %s is outside of the earth disk", oProj));

		double dS1 = m_dOrbitRadius - dSn * dCosX * dCosY;
		double dS2 = dSn * Math.sin(dX) * dCosY;
		double dS3 = -dSn * dSinY;
		double dSxy = Math.sqrt(dS1 * dS1 + dS2 * dS2);

		double dLon = Math.atan(dS2 / dS1) * GeoConst.DEGPERRAD + m_dSubLon;
		double dLat = Math.atan(GeoConst.EARTH_IE2 * (dS3 / dSxy)) * GeoConst.DEGPERRAD;

		return new MapPoint(dLat, normalizeLon(dLon));
	}


	/**
	 * Wraps the given longitude into (-180, 180]
	 * @param dLon longitude in decimal degrees
	 * @return the equivalent longitude in (-180, 180]
	 */
	static double normalizeLon(double dLon)
	{
		while (dLon > 180.0)
			dLon -= 360.0;
		while (dLon <= -180.0)
			dLon += 360.0;
		return dLon;
	}


	@Override
	public String format()
	{
		return String.format("GEOS(sublon: %s, orbitRadius: %s)", m_dSubLon, m_dOrbitRadius);
	}
}

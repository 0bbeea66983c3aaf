package geosat.proj;

/**
 * Earth and orbit parameters used by the normalized geostationary projection.
 * Values follow the LRIT/HRIT Global Specification (CGMS 03, par. 4.4).
 * @author aaron.cherney
 */
public abstract class GeoConst
{
	/**
	 * Equatorial radius of the earth in km
	 */
	public static final double EARTH_RADIUS_EQ = 6378.1690;


	/**
	 * Polar radius of the earth in km
	 */
	public static final double EARTH_RADIUS_POL = 6356.5838;


	/**
	 * Distance from the center of the earth to a geostationary satellite in km
	 */
	public static final double ORBIT_RADIUS = 42164.0;


	/**
	 * Squared eccentricity of the earth ellipsoid, 1 - (rpol/req)^2
	 */
	public static final double EARTH_E2 = 1.0 - (EARTH_RADIUS_POL * EARTH_RADIUS_POL) / (EARTH_RADIUS_EQ * EARTH_RADIUS_EQ);


	/**
	 * 1 - e^2, equal to rpol^2 / req^2
	 */
	public static final double EARTH_1E2 = 1.0 - EARTH_E2;


	/**
	 * 1 / (1 - e^2), equal to req^2 / rpol^2
	 */
	public static final double EARTH_IE2 = 1.0 / EARTH_1E2;


	/**
	 * Pi
	 */
	public static final double PI = Math.PI;


	/**
	 * Pi divided by 180
	 */
	public static final double PIOVER180 = PI / 180.0;


	/**
	 * 180 divided by Pi
	 */
	public static final double DEGPERRAD = 180.0 / PI;
}

package geosat.proj;

/**
 * Geographic coordinate in decimal degrees.
 * @author aaron.cherney
 */
public final class MapPoint
{
	/**
	 * Latitude in decimal degrees, [-90, 90]
	 */
	public final double m_dLat;


	/**
	 * Longitude in decimal degrees
	 */
	public final double m_dLon;


	/**
	 * Constructs a MapPoint with the given latitude and longitude
	 * @param dLat latitude in decimal degrees
	 * @param dLon longitude in decimal degrees
	 * @throws IllegalArgumentException if the latitude is outside of [-90, 90]
	 */
	public MapPoint(double dLat, double dLon)
	{
		if (!(dLat >= -90.0 && dLat <= 90.0))
			throw new IllegalArgumentException(String.format("Latitude %f out of range", dLat));
		m_dLat = dLat;
		m_dLon = dLon;
	}


	@Override
	public String toString()
	{
		return String.format("(lat: %f, lon: %f)", m_dLat, m_dLon);
	}
}

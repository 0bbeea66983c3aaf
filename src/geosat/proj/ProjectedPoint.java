package geosat.proj;

/**
 * Point in a projected coordinate system. For {@link Geos} the coordinates are
 * view angles in degrees from the sub-satellite point.
 * @author aaron.cherney
 */
public final class ProjectedPoint
{
	/**
	 * Horizontal coordinate, increasing eastward
	 */
	public final double m_dX;


	/**
	 * Vertical coordinate, increasing southward
	 */
	public final double m_dY;


	public ProjectedPoint(double dX, double dY)
	{
		m_dX = dX;
		m_dY = dY;
	}


	@Override
	public String toString()
	{
		return String.format("(x: %f, y: %f)", m_dX, m_dY);
	}
}

package geosat.proj;

/**
 * Thrown when a point has no solution in the target coordinate system, for
 * example a geographic point hidden from the satellite or a view angle that
 * does not intersect the earth.
 * @author aaron.cherney
 */
public class InvalidGeometryException extends RuntimeException
{
	public InvalidGeometryException(String sMessage)
	{
		super(sMessage);
	}
}

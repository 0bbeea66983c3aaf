/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package geosat.proj;

/**
 * Base class for projected coordinate systems that convert points from
 * lon/lat to projected coordinates and vice versa. Implementations are
 * immutable so a single instance can be shared by every image that uses the
 * same parameters.
 * @author aaron.cherney
 */
public abstract class Projection
{
	/**
	 * Converts a geographic point to the projected coordinate system
	 * @param oMap geographic point in decimal degrees
	 * @return the corresponding projected point
	 * @throws InvalidGeometryException if the point cannot be projected
	 */
	public abstract ProjectedPoint mapToProjected(MapPoint oMap);


	/**
	 * Converts a projected point to geographic coordinates
	 * @param oProj point in the projected coordinate system
	 * @return the corresponding geographic point in decimal degrees
	 * @throws InvalidGeometryException if the point does not correspond to a
	 * location on the earth
	 */
	public abstract MapPoint projectedToMap(ProjectedPoint oProj);


	/**
	 * @return a short description of the projection and its parameters
	 */
	public abstract String format();


	@Override
	public String toString()
	{
		return format();
	}
}

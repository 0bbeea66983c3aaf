package geosat.collect;

/**
 * Spacecraft identifiers.
 * @author aaron.cherney
 */
public abstract class Spacecraft
{
	/**
	 * WMO ids of Meteosat 8 to 11 (MSG-1 to MSG-4)
	 */
	public static final int MSG1 = 55;

	public static final int MSG2 = 56;

	public static final int MSG3 = 57;

	public static final int MSG4 = 70;


	/**
	 * Converts the spacecraft id found in HRIT headers and SAF products to the
	 * WMO id. Unknown ids are returned unchanged.
	 * @param nHritId HRIT spacecraft id
	 * @return the WMO spacecraft id
	 */
	public static int fromHrit(int nHritId)
	{
		switch (nHritId)
		{
			case 321:
				return MSG1;
			case 322:
				return MSG2;
			case 323:
				return MSG3;
			case 324:
				return MSG4;
			default:
				return nHritId;
		}
	}
}

package geosat.store;

/**
 * Receives the images produced by an importer, one at a time.
 * @author Federal Highway Administration
 */
public interface ImageConsumer
{
	/**
	 * Handles one image. The consumer can keep a reference to the image.
	 * @param oImage the image
	 */
	public void processImage(Image oImage);
}

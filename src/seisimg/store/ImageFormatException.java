package seisimg.store;

import java.io.IOException;

/**
 * Signals that an image file, or a value decoded from one, does not follow
 * the image file format. The {@link Reason} tells callers which check failed.
 */
public class ImageFormatException extends IOException
{
	private static final long serialVersionUID = 1L;


	/**
	 * Categories of format failures
	 */
	public enum Reason
	{
		/**
		 * The stream ended before a record or sample block was complete
		 */
		TRUNCATED,

		/**
		 * The precision code is not 4 or 8
		 */
		INVALID_PRECISION,

		/**
		 * A patch dimension is not positive, or the patch count is negative or
		 * larger than the configured limit
		 */
		INVALID_DIMENSIONS,

		/**
		 * The plane code is not 0, 1 or 2
		 */
		INVALID_PLANE,

		/**
		 * The mode code is not in the table of the image's quantity kind
		 */
		UNKNOWN_MODE,

		/**
		 * The quantity kind was neither given nor found in the configuration
		 */
		UNKNOWN_QUANTITY_KIND
	}


	private final Reason m_oReason;


	public ImageFormatException(Reason oReason, String sMessage)
	{
		super(sMessage);
		m_oReason = oReason;
	}


	public ImageFormatException(Reason oReason, String sMessage, Throwable oCause)
	{
		super(sMessage, oCause);
		m_oReason = oReason;
	}


	public Reason getReason()
	{
		return m_oReason;
	}


	@Override
	public String getMessage()
	{
		return m_oReason + ": " + super.getMessage();
	}
}

package seisimg.system;

import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Buffered input stream that reads primitive values in a configurable byte
 * order. Binary files written by the simulation codes use the native order of
 * the machine they ran on, which {@link java.io.DataInputStream} cannot read
 * without swapping every value.
 * <p>
 * All of the {@code read*} methods that return values throw
 * {@link EOFException} if the stream ends before the value is complete.
 * </p>
 */
public class ByteOrderInStream extends FilterInputStream
{
	/**
	 * Default 16k buffer size
	 */
	protected static final int BUFFER_SIZE = 16384;


	/**
	 * Value the position can get to before more bytes need to be read into
	 * the buffer
	 */
	private int m_nLimit;


	/**
	 * Current position in buffer
	 */
	private int m_nPos;


	/**
	 * Buffer
	 */
	private final byte[] m_yBuf;


	/**
	 * Scratch space for single values, wrapped by {@link #m_oValue}
	 */
	private final byte[] m_yValue = new byte[8];


	private final ByteBuffer m_oValue;


	/**
	 * Byte order of the values in the stream
	 */
	private final ByteOrder m_oOrder;


	/**
	 * Total number of bytes consumed from this stream
	 */
	private long m_lBytesRead = 0;


	/**
	 * Constructs a ByteOrderInStream wrapping the given InputStream, using a
	 * buffer of the given size
	 * @param oInputStream InputStream to wrap
	 * @param oOrder byte order of the values in the stream
	 * @param nSize Buffer size
	 */
	public ByteOrderInStream(InputStream oInputStream, ByteOrder oOrder, int nSize)
	{
		super(oInputStream);
		m_yBuf = new byte[nSize];
		m_oOrder = oOrder;
		m_oValue = ByteBuffer.wrap(m_yValue).order(oOrder);
	}


	/**
	 * Constructs a ByteOrderInStream wrapping the given InputStream, using the
	 * default buffer size
	 * @param oInputStream InputStream to wrap
	 * @param oOrder byte order of the values in the stream
	 */
	public ByteOrderInStream(InputStream oInputStream, ByteOrder oOrder)
	{
		this(oInputStream, oOrder, BUFFER_SIZE);
	}


	public ByteOrder getOrder()
	{
		return m_oOrder;
	}


	/**
	 * @return number of bytes consumed from the stream so far
	 */
	public long getBytesRead()
	{
		return m_lBytesRead;
	}


	@Override
	public int read()
		throws IOException
	{
		if (m_nPos >= m_nLimit) // check for empty buffer
		{
			if ((m_nLimit = in.read(m_yBuf, 0, m_yBuf.length)) <= 0)
				return -1; // no bytes to read and/or read failed

			m_nPos = 0; // reset buffer read position
		}
		++m_lBytesRead;
		return ((int)m_yBuf[m_nPos++]) & 0xff;
	}


	@Override
	public int read(byte[] yBuf, int nOff, int nLen)
		throws IOException
	{
		int nStart = nOff; // save for length calculation
		while (nLen > 0) // repeat until request is fulfilled or stream end
		{
			if (m_nPos >= m_nLimit) // check for empty buffer
			{
				if ((m_nLimit = in.read(m_yBuf, 0, m_yBuf.length)) <= 0)
				{
					m_nLimit = 0;
					break; // no bytes to read and/or read failed
				}

				m_nPos = 0; // reset buffer read position
			}

			int nBytes = Math.min(nLen, m_nLimit - m_nPos); // available bytes
			System.arraycopy(m_yBuf, m_nPos, yBuf, nOff, nBytes); // copy buffer
			m_nPos += nBytes; // adjust buffer position
			nOff += nBytes; // increment dest offset
			nLen -= nBytes; // decrement remaining length
		}
		int nCopied = nOff - nStart;
		m_lBytesRead += nCopied;
		if (nCopied == 0 && nLen > 0)
			return -1;
		return nCopied; // return copied byte count
	}


	@Override
	public long skip(long lBytes)
		throws IOException
	{
		int nAvailable = (m_nLimit - m_nPos);
		if (lBytes <= nAvailable)
		{
			m_nPos += lBytes;
			m_lBytesRead += lBytes;
			return lBytes;
		}

		m_nPos = m_nLimit; // skip buffer entirely
		long lSkipped = in.skip(lBytes - nAvailable) + nAvailable; // include skipped buffer
		m_lBytesRead += lSkipped;
		return lSkipped;
	}


	@Override
	public boolean markSupported()
	{
		return false;
	}


	/**
	 * Reads exactly {@code nLen} bytes into the given array.
	 *
	 * @param yBuf destination
	 * @param nOff offset into the destination
	 * @param nLen number of bytes to read
	 * @throws EOFException if the stream ends first
	 * @throws IOException if the underlying stream fails
	 */
	public void readFully(byte[] yBuf, int nOff, int nLen)
		throws IOException
	{
		int nRead = read(yBuf, nOff, nLen);
		if (nRead != nLen)
			throw new EOFException(String.format("Expected %d bytes, stream ended after %d", nLen, Math.max(nRead, 0)));
	}


	public int readInt()
		throws IOException
	{
		readFully(m_yValue, 0, 4);
		return m_oValue.getInt(0);
	}


	public float readFloat()
		throws IOException
	{
		readFully(m_yValue, 0, 4);
		return m_oValue.getFloat(0);
	}


	public double readDouble()
		throws IOException
	{
		readFully(m_yValue, 0, 8);
		return m_oValue.getDouble(0);
	}


	/**
	 * Reads a fixed width ASCII text field. Trailing NUL characters and
	 * whitespace are removed.
	 *
	 * @param nLen width of the field in bytes
	 * @return the trimmed text
	 * @throws IOException
	 */
	public String readAscii(int nLen)
		throws IOException
	{
		byte[] yText = new byte[nLen];
		readFully(yText, 0, nLen);
		int nEnd = 0;
		while (nEnd < nLen && yText[nEnd] != 0)
			++nEnd;
		return new String(yText, 0, nEnd, StandardCharsets.US_ASCII).trim();
	}


	/**
	 * Reads floating point values of the given width into the destination
	 * array, widening 4 byte values to double.
	 *
	 * @param dDest destination
	 * @param nOff offset into the destination
	 * @param nCount number of values to read
	 * @param nWidth width in bytes of each value, 4 or 8
	 * @throws EOFException if the stream ends before all values are read
	 * @throws IOException if the underlying stream fails
	 */
	public void readReals(double[] dDest, int nOff, int nCount, int nWidth)
		throws IOException
	{
		if (nWidth != 4 && nWidth != 8)
			throw new IllegalArgumentException("Invalid value width: " + nWidth);

		int nChunk = Math.max(1, m_yBuf.length / nWidth); // values per bulk read
		byte[] yChunk = new byte[Math.min(nCount, nChunk) * nWidth];
		ByteBuffer oChunk = ByteBuffer.wrap(yChunk).order(m_oOrder);
		while (nCount > 0)
		{
			int nValues = Math.min(nCount, nChunk);
			readFully(yChunk, 0, nValues * nWidth);
			oChunk.clear();
			if (nWidth == 4)
			{
				for (int nIndex = 0; nIndex < nValues; nIndex++)
					dDest[nOff++] = oChunk.getFloat();
			}
			else
			{
				for (int nIndex = 0; nIndex < nValues; nIndex++)
					dDest[nOff++] = oChunk.getDouble();
			}
			nCount -= nValues;
		}
	}
}

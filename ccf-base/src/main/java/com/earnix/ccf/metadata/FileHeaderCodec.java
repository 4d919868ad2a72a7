package com.earnix.ccf.metadata;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.schema.ColumnDescriptor;
import com.earnix.ccf.schema.DataType;
import com.earnix.ccf.utils.CcfMagicUtils;
import com.earnix.ccf.utils.LittleEndianReader;
import com.earnix.ccf.utils.LittleEndianWriter;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Serializes and parses the file header.
 *
 * <pre>
 * offset size
 * 0      8    MAGIC "CCFv1\0\0\0"
 * 8      1    VERSION
 * 9      4    HEADER_SIZE   length of the metadata entries below
 * 13     8    NUM_ROWS
 * 21     2    NUM_COLUMNS
 * 23     HEADER_SIZE bytes of entries, per column:
 *             NAME_LEN u16 | NAME utf-8 | DTYPE u8 | OFFSET u64 | COMPRESSED_SIZE u64 | UNCOMPRESSED_SIZE u64
 * </pre>
 */
public class FileHeaderCodec
{
	public static final int CURRENT_VERSION = 1;

	/**
	 * Size of the fixed part of the header preceding the metadata entries
	 */
	public static final int PREAMBLE_SIZE = 23;

	private static final int HEADER_SIZE_POS = 9;
	private static final int FIXED_ENTRY_SIZE = Short.BYTES + Byte.BYTES + 3 * Long.BYTES;
	private static final int MAX_COLUMNS = 0xFFFF;
	private static final int MAX_NAME_LEN = 0xFFFF;

	private FileHeaderCodec()
	{
	}

	/**
	 * Compute HEADER_SIZE for a schema. Entries have a fixed size once the names are known, so offsets can be assigned
	 * before the header is serialized.
	 *
	 * @param columns the columns in schema order
	 * @return the length of the metadata entries region
	 */
	public static long metadataEntriesSize(List<ColumnDescriptor> columns)
	{
		long size = 0;
		for (ColumnDescriptor column : columns)
		{
			size += FIXED_ENTRY_SIZE + LittleEndianWriter.encodeUtf8(column.getName()).length;
		}
		return size;
	}

	/**
	 * Serialize the preamble and the metadata entries
	 *
	 * @param numRows the row count
	 * @param columns column entries with their final offsets, in schema order
	 * @return the complete header bytes
	 */
	public static byte[] encode(long numRows, List<ColumnMetaData> columns)
	{
		if (columns.size() > MAX_COLUMNS)
			throw new IllegalArgumentException("Too many columns: " + columns.size());

		LittleEndianWriter writer = new LittleEndianWriter();
		writer.writeBytes(CcfMagicUtils.magicBytes());
		writer.writeUnsignedByte(CURRENT_VERSION);
		// patched once the entries are written
		writer.writeUnsignedInt(0);
		writer.writeUnsignedLong(numRows);
		writer.writeUnsignedShort(columns.size());

		for (ColumnMetaData column : columns)
		{
			byte[] name = LittleEndianWriter.encodeUtf8(column.getName());
			if (name.length > MAX_NAME_LEN)
				throw new IllegalArgumentException("Column name too long: " + name.length + " bytes");
			writer.writeUnsignedShort(name.length);
			writer.writeBytes(name);
			writer.writeUnsignedByte(column.getType().getCode());
			writer.writeUnsignedLong(column.getOffset());
			writer.writeUnsignedLong(column.getCompressedSize());
			writer.writeUnsignedLong(column.getUncompressedSize());
		}

		byte[] header = writer.toByteArray();
		LittleEndianWriter.patchUnsignedInt(header, HEADER_SIZE_POS, header.length - PREAMBLE_SIZE);
		return header;
	}

	/**
	 * Parse the header from a stream positioned at the start of the file. Consumes exactly the header bytes.
	 *
	 * @param is             the stream
	 * @param availableBytes the number of bytes the source holds, used to reject impossible header sizes before
	 *                       allocating them
	 * @return the parsed metadata
	 * @throws CcfException on any format violation
	 * @throws IOException  on failure reading the stream
	 */
	public static CcfFileMetaData decode(InputStream is, long availableBytes) throws IOException
	{
		return decodeEntries(is, decodePreamble(is, availableBytes));
	}

	/**
	 * Parse the first {@link #PREAMBLE_SIZE} bytes of the file
	 *
	 * @param is             a stream positioned at the start of the file
	 * @param availableBytes the number of bytes the source holds
	 * @return the preamble, with a header size that fits in the source
	 * @throws CcfException on any format violation
	 * @throws IOException  on failure reading the stream
	 */
	public static Preamble decodePreamble(InputStream is, long availableBytes) throws IOException
	{
		byte[] magic = readRegion(is, CcfMagicUtils.magicLength(), "magic");
		CcfMagicUtils.expectMagic(new LittleEndianReader(magic, "magic"));

		int version = new LittleEndianReader(readRegion(is, Byte.BYTES, "version"), "version").readUnsignedByte();
		if (version != CURRENT_VERSION)
			throw new CcfException.UnsupportedVersion(version);

		LittleEndianReader preamble = new LittleEndianReader(
				readRegion(is, PREAMBLE_SIZE - HEADER_SIZE_POS, "preamble"), "preamble");
		long headerSize = preamble.readUnsignedInt();
		long numRows = preamble.readUnsignedLong();
		int numColumns = preamble.readUnsignedShort();

		if (numRows < 0 || numRows > Integer.MAX_VALUE)
			throw new CcfException.SchemaMismatch("Row count " + Long.toUnsignedString(numRows) + " is not supported");
		if (headerSize > Integer.MAX_VALUE - PREAMBLE_SIZE)
			throw new CcfException.HeaderSizeMismatch("Header size " + headerSize + " is not supported");
		if (PREAMBLE_SIZE + headerSize > availableBytes)
			throw new CcfException.TruncatedInput(
					"Header of " + headerSize + " bytes does not fit in " + availableBytes + " bytes of input");
		return new Preamble(version, headerSize, numRows, numColumns);
	}

	/**
	 * Parse the metadata entries that follow the preamble
	 *
	 * @param is       a stream positioned right after the preamble
	 * @param preamble the already parsed preamble
	 * @return the parsed metadata
	 * @throws CcfException on any format violation
	 * @throws IOException  on failure reading the stream
	 */
	public static CcfFileMetaData decodeEntries(InputStream is, Preamble preamble) throws IOException
	{
		long headerSize = preamble.getHeaderSize();
		byte[] entries = readRegion(is, (int) headerSize, "metadata entries");
		List<ColumnMetaData> columns = parseEntries(new LittleEndianReader(entries, "metadata entries"),
				preamble.getNumColumns(), headerSize);
		return new CcfFileMetaData(preamble.getVersion(), preamble.getNumRows(), headerSize, columns);
	}

	private static List<ColumnMetaData> parseEntries(LittleEndianReader reader, int numColumns, long headerSize)
			throws CcfException
	{
		List<ColumnMetaData> columns = new ArrayList<>(numColumns);
		Set<String> names = new HashSet<>();
		try
		{
			for (int i = 0; i < numColumns; i++)
			{
				ColumnMetaData column = decodeEntry(reader, i);
				if (!names.add(column.getName()))
					throw new CcfException.SchemaMismatch("Duplicate column name: " + column.getName());
				columns.add(column);
			}
		}
		catch (CcfException.TruncatedInput ex)
		{
			throw new CcfException.HeaderSizeMismatch(
					"Metadata entry " + columns.size() + " of " + numColumns + " runs past the declared header size "
							+ headerSize);
		}

		if (reader.remaining() != 0)
			throw new CcfException.HeaderSizeMismatch(
					numColumns + " metadata entries use " + reader.position() + " bytes but the header size is "
							+ headerSize);
		return columns;
	}

	private static ColumnMetaData decodeEntry(LittleEndianReader reader, int index) throws CcfException
	{
		int nameLen = reader.readUnsignedShort();
		if (nameLen == 0)
			throw new CcfException.SchemaMismatch("Column " + index + " has an empty name");
		byte[] nameBytes = reader.readBytes(nameLen);
		String name;
		try
		{
			name = LittleEndianReader.decodeUtf8(ByteBuffer.wrap(nameBytes));
		}
		catch (CharacterCodingException ex)
		{
			throw new CcfException.SchemaMismatch("Name of column " + index + " is not valid UTF-8");
		}
		DataType type = DataType.fromCode(reader.readUnsignedByte());
		long offset = reader.readUnsignedLong();
		long compressedSize = reader.readUnsignedLong();
		long uncompressedSize = reader.readUnsignedLong();
		return new ColumnMetaData(new ColumnDescriptor(name, type), offset, compressedSize, uncompressedSize);
	}

	private static byte[] readRegion(InputStream is, int len, String regionName) throws IOException
	{
		byte[] buf = new byte[len];
		int read = IOUtils.read(is, buf);
		if (read != len)
			throw new CcfException.TruncatedInput(
					"Input ended after " + read + " of " + len + " bytes of the " + regionName);
		return buf;
	}

	/**
	 * The fixed fields at the start of the file
	 */
	public static final class Preamble
	{
		private final int version;
		private final long headerSize;
		private final long numRows;
		private final int numColumns;

		Preamble(int version, long headerSize, long numRows, int numColumns)
		{
			this.version = version;
			this.headerSize = headerSize;
			this.numRows = numRows;
			this.numColumns = numColumns;
		}

		public int getVersion()
		{
			return version;
		}

		/**
		 * @return length of the metadata entries region, which starts at {@link #PREAMBLE_SIZE}
		 */
		public long getHeaderSize()
		{
			return headerSize;
		}

		public long getNumRows()
		{
			return numRows;
		}

		public int getNumColumns()
		{
			return numColumns;
		}
	}
}

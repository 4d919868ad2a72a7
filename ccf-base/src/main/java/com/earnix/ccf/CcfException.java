package com.earnix.ccf;

import java.io.IOException;

/**
 * Base class for every failure to interpret bytes as a CCF file. Each {@link ErrorKind} has its own nested subclass
 * so callers may catch exactly the failure they care about.
 */
public abstract class CcfException extends IOException
{
	public enum ErrorKind
	{
		BAD_MAGIC,
		UNSUPPORTED_VERSION,
		HEADER_SIZE_MISMATCH,
		TRUNCATED_INPUT,
		CORRUPT_BLOCK,
		SCHEMA_MISMATCH,
		UNKNOWN_COLUMN
	}

	private final ErrorKind kind;

	protected CcfException(ErrorKind kind, String message)
	{
		super(message);
		this.kind = kind;
	}

	protected CcfException(ErrorKind kind, String message, Throwable cause)
	{
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	/**
	 * The leading bytes are not the CCF magic
	 */
	public static class BadMagic extends CcfException
	{
		public BadMagic(String message)
		{
			super(ErrorKind.BAD_MAGIC, message);
		}
	}

	/**
	 * The file declares a format version this codec does not understand
	 */
	public static class UnsupportedVersion extends CcfException
	{
		private final int version;

		public UnsupportedVersion(int version)
		{
			super(ErrorKind.UNSUPPORTED_VERSION, "Unsupported CCF version: " + version);
			this.version = version;
		}

		public int getVersion()
		{
			return version;
		}
	}

	/**
	 * The metadata entries do not exactly fill the declared header region
	 */
	public static class HeaderSizeMismatch extends CcfException
	{
		public HeaderSizeMismatch(String message)
		{
			super(ErrorKind.HEADER_SIZE_MISMATCH, message);
		}
	}

	/**
	 * Input ended before a fixed-width field or a declared-length region
	 */
	public static class TruncatedInput extends CcfException
	{
		public TruncatedInput(String message)
		{
			super(ErrorKind.TRUNCATED_INPUT, message);
		}
	}

	/**
	 * A column block failed to decompress, decompressed to the wrong size, or holds an inconsistent payload
	 */
	public static class CorruptBlock extends CcfException
	{
		public CorruptBlock(String message)
		{
			super(ErrorKind.CORRUPT_BLOCK, message);
		}

		public CorruptBlock(String message, Throwable cause)
		{
			super(ErrorKind.CORRUPT_BLOCK, message, cause);
		}
	}

	/**
	 * A block decompressed cleanly but to a different length than its metadata declares: either the header lied or the
	 * stored bytes were altered
	 */
	public static class UncompressedSizeMismatch extends CorruptBlock
	{
		private final long declaredSize;
		private final long actualSize;

		/**
		 * @param declaredSize the size from the column metadata
		 * @param actualSize   the decompressed size, or declaredSize + 1 when decompression stopped early
		 * @param complete     whether the whole stream was decompressed
		 */
		public UncompressedSizeMismatch(long declaredSize, long actualSize, boolean complete)
		{
			super("Block decompressed to " + (complete ? "" : "more than ") + (complete ? actualSize : declaredSize)
					+ " bytes but the header declares " + declaredSize);
			this.declaredSize = declaredSize;
			this.actualSize = actualSize;
		}

		public long getDeclaredSize()
		{
			return declaredSize;
		}

		public long getActualSize()
		{
			return actualSize;
		}
	}

	/**
	 * Duplicate or invalid column names, an unknown type code, or a bitmap length that does not match the row count
	 */
	public static class SchemaMismatch extends CcfException
	{
		public SchemaMismatch(String message)
		{
			super(ErrorKind.SCHEMA_MISMATCH, message);
		}
	}

	/**
	 * A requested column is not part of the file schema
	 */
	public static class UnknownColumn extends CcfException
	{
		private final String columnName;

		public UnknownColumn(String columnName)
		{
			super(ErrorKind.UNKNOWN_COLUMN, "No such column: " + columnName);
			this.columnName = columnName;
		}

		public String getColumnName()
		{
			return columnName;
		}
	}
}

package com.earnix.ccf.file;

import com.earnix.ccf.CcfException;
import com.earnix.ccf.file.reader.FileRangeInputStreamSupplier;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileRangeInputStreamSupplierTest
{
	private Path tmpFolder;
	private Path file;

	@Before
	public void setUp() throws Exception
	{
		tmpFolder = Files.createTempDirectory("file_range_test");
		file = tmpFolder.resolve("bytes.bin");
		byte[] bytes = new byte[100];
		for (int i = 0; i < bytes.length; i++)
		{
			bytes[i] = (byte) i;
		}
		Files.write(file, bytes);
	}

	@After
	public void tearDown() throws Exception
	{
		FileUtils.forceDelete(tmpFolder.toFile());
	}

	@Test
	public void readsOnlyTheRange() throws Exception
	{
		try (InputStream is = new FileRangeInputStreamSupplier(file, 10, 5).get())
		{
			Assert.assertArrayEquals(new byte[] { 10, 11, 12, 13, 14 }, IOUtils.toByteArray(is));
		}
	}

	@Test
	public void rangePastEndOfFile()
	{
		Assert.assertThrows(CcfException.TruncatedInput.class,
				() -> new FileRangeInputStreamSupplier(file, 101, 0).get());
		Assert.assertThrows(CcfException.TruncatedInput.class,
				() -> new FileRangeInputStreamSupplier(file, 90, 11).get());
		Assert.assertThrows(IllegalArgumentException.class, () -> new FileRangeInputStreamSupplier(file, -1, 1));
	}
}

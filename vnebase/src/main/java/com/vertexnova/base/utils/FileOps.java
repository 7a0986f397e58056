/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.base.utils;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FileOps
{
	public static void ensureDirExists(String pthnam) throws java.io.IOException {ensureDirExists(Paths.get(pthnam));}
	public static void ensureDirExists(java.io.File dirh) throws java.io.IOException {ensureDirExists(dirh.toPath());}
	public static int deleteDirectory(String pthnam) throws java.io.IOException {return deleteDirectory(new java.io.File(pthnam));}
	public static void writeTextFile(String pthnam, String txt) throws java.io.IOException {writeTextFile(new java.io.File(pthnam), txt, false);}

	public static void ensureDirExists(Path dirh) throws java.io.IOException
	{
		Files.createDirectories(dirh);
	}

	/**
	 * Deletes the directory and everything under it. Returns the number of plain files deleted.
	 * A non-existent directory is not an error.
	 */
	public static int deleteDirectory(java.io.File dirh) throws java.io.IOException
	{
		if (!dirh.exists()) return 0;
		java.io.File[] files = dirh.listFiles();
		int cnt = 0;

		if (files != null) {
			for (int idx = 0; idx != files.length; idx++) {
				if (files[idx].isDirectory()) {
					cnt += deleteDirectory(files[idx]);
				} else {
					deleteFile(files[idx]);
					cnt++;
				}
			}
		}
		deleteFile(dirh);
		return cnt;
	}

	public static void deleteFile(java.io.File fh) throws java.io.IOException
	{
		if (!fh.delete() && fh.exists()) throw new java.io.IOException("Failed to delete file="+fh.getAbsolutePath());
	}

	public static String readAsText(java.io.InputStream strm, String charset) throws java.io.IOException
	{
		byte[] buf = strm.readAllBytes();
		Charset cset = (charset == null ? StandardCharsets.UTF_8 : Charset.forName(charset));
		return new String(buf, cset);
	}

	public static String readAsText(java.io.File fh, String charset) throws java.io.IOException
	{
		try (java.io.InputStream strm = Files.newInputStream(fh.toPath())) {
			return readAsText(strm, charset);
		}
	}

	public static String readAsText(java.net.URL url, String charset) throws java.io.IOException
	{
		try (java.io.InputStream strm = url.openStream()) {
			return readAsText(strm, charset);
		}
	}

	// creates the parent directory if necessary
	public static void writeTextFile(java.io.File fh, String txt, boolean append) throws java.io.IOException
	{
		java.io.File dirh = fh.getAbsoluteFile().getParentFile();
		if (dirh != null) ensureDirExists(dirh);
		try (java.io.FileOutputStream strm = new java.io.FileOutputStream(fh, append)) {
			strm.write(txt.getBytes(StandardCharsets.UTF_8));
		}
	}
}

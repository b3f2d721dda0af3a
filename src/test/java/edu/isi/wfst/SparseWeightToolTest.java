package edu.isi.wfst;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

final class SparseWeightToolTest {

  private static String runText(String input, String... args) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int status = SparseWeightTool.run(args, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
    assertEquals(0, status);
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  void textPassThroughNormalizes() {
    String out = runText("(0,1,2)\n\n( 1 , 2 , 1 , 3 , 4 )\n", "-m", "real");
    assertEquals("(0.0,1,2.0)\n(1.0,3,4.0)\n", out);
  }

  @Test
  void binaryRoundTripThroughFiles(@TempDir File dir) throws IOException {
    File text = new File(dir, "in.txt");
    File bin = new File(dir, "out.bin");
    File back = new File(dir, "back.txt");
    Files.write(text.toPath(), "(Infinity,2,1.5,7,3.0)\n(0.0)\n".getBytes(StandardCharsets.UTF_8));

    assertEquals(0, SparseWeightTool.run(new String[] { "-o", "binary", text.getPath(), bin.getPath() },
        System.in, System.out));
    assertTrue(bin.length() > 0);
    assertEquals(0, SparseWeightTool.run(new String[] { "-i", "binary", bin.getPath(), back.getPath() },
        System.in, System.out));
    assertEquals("(Infinity,2,1.5,7,3.0)\n(0.0)\n",
        new String(Files.readAllBytes(back.toPath()), StandardCharsets.UTF_8));
  }

  @Test
  void quantizeAndReverse() {
    String out = runText("(0.3,1,0.26)\n", "-m", "log", "-r", "-q", "0.5");
    assertEquals("(0.3,1,0.5)\n", out);
  }

  @Test
  void listShowsRegisteredSemirings() {
    String out = runText("", "--list");
    assertTrue(out.contains("tropical\n"));
    assertTrue(out.contains("log\n"));
    assertTrue(out.contains("real\n"));
  }

  @Test
  void failures() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    assertEquals(1, SparseWeightTool.run(new String[] { "-m", "nonesuch" },
        new ByteArrayInputStream(new byte[0]), out));
    assertEquals(1, SparseWeightTool.run(new String[0],
        new ByteArrayInputStream("(0,1)\n".getBytes(StandardCharsets.UTF_8)), out));
    assertEquals(1, SparseWeightTool.run(new String[] { "-i", "hex" },
        new ByteArrayInputStream(new byte[0]), out));
    assertEquals(1, SparseWeightTool.run(new String[] { "-q", "-1" },
        new ByteArrayInputStream(new byte[0]), out));
    assertEquals(1, SparseWeightTool.run(new String[] { "/no/such/file" },
        new ByteArrayInputStream(new byte[0]), out));
    assertEquals(0, out.size());
  }

  @Test
  void unwritableOutputFails(@TempDir File dir) throws IOException {
    File in = new File(dir, "in.txt");
    Files.write(in.toPath(), "(0,1,2)\n".getBytes(StandardCharsets.UTF_8));
    // a directory can't be opened for writing
    assertEquals(1, SparseWeightTool.run(new String[] { in.getPath(), dir.getPath() },
        System.in, System.out));
  }
}

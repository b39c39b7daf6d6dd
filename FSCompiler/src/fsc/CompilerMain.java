package fsc;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;

public class CompilerMain {

  public static void main(String[] args) throws IOException {
    int status = run(args);
    if (status != 0) System.exit(status);
  }

  /** Compiles as {@link #main} does and returns the process exit status. */
  static int run(String[] args) throws IOException {
    if (args.length < 2 || args.length > 3) {
      System.err.println("Usage: $COMPILER project_file output_dir [block_definitions]");
      return 1;
    }

    BlockRegistry registry;
    try {
      registry =
          args.length == 3
              ? BlockRegistryLoader.load(new File(args[2]).toURI().toURL())
              : BlockRegistry.standard();
    } catch (RegistryMisconfiguredException ex) {
      System.out.println("Block definitions are invalid: " + ex.getMessage());
      return 1;
    } catch (IOException ex) {
      System.out.println("Cannot read block definitions: " + ex.getMessage());
      return 1;
    }

    Project project;
    try {
      project = ProjectReader.read(new File(args[0]));
    } catch (IOException ex) {
      System.out.println("Cannot read project: " + ex.getMessage());
      return 1;
    }

    CompileResult result;
    try {
      result = new FlipperScriptCompiler(registry).compile(project);
    } catch (CompilerException ex) {
      ex.print();
      return 1;
    }
    result.diagnostics().forEach(Diagnostic::print);
    if (!result.succeeded()) {
      System.out.println(
          String.format(
              "Compilation failed with %d errors.  See errors above.", result.errors().size()));
      return 1;
    }

    File outDir = new File(args[1]);
    if (!outDir.isDirectory() && !outDir.mkdirs())
      throw new IOException("cannot create output directory " + outDir);
    File out = new File(outDir, project.manifest().appid() + ".c");
    write(result.program().get().source(), out);

    System.out.println(String.format("Compilation succeeded! Wrote %s", out));
    return 0;
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}

/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.minitest.loader;

import io.minitest.core.TestFile;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads a {@code .java} test file by compiling it in memory and defining the
 * classes in a brand-new class loader.
 * <p>
 * A new class loader per load means on-disk edits are always picked up and
 * static fields of a test file start from scratch on every run.
 */
public class JavaSourceLoader implements TestFileLoader {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final Pattern PACKAGE = Pattern.compile("^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);

    private final String classPath;

    public JavaSourceLoader() {
        this(defaultClassPath());
    }

    public JavaSourceLoader(String classPath) {
        this.classPath = classPath;
    }

    @Override
    public TestFile load(Path file) {
        String fileName = file.getFileName().toString();
        if (!fileName.endsWith(".java")) {
            throw new LoadException("not a java source file: " + file);
        }
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoadException("unable to read " + file + ": " + e.getMessage(), e);
        }
        String simpleName = fileName.substring(0, fileName.length() - ".java".length());
        Matcher matcher = PACKAGE.matcher(source);
        String className = matcher.find() ? matcher.group(1) + "." + simpleName : simpleName;
        long startTime = System.currentTimeMillis();
        Map<String, byte[]> classes = compile(file, className, source);
        logger.debug("compiled {} in {}ms", file, System.currentTimeMillis() - startTime);
        ClassLoader classLoader = new MemoryClassLoader(classes, TestFile.class.getClassLoader());
        Class<?> clazz;
        try {
            clazz = classLoader.loadClass(className);
        } catch (ClassNotFoundException e) {
            throw new LoadException(file + " does not declare class " + className, e);
        }
        if (!TestFile.class.isAssignableFrom(clazz)) {
            throw new LoadException(className + " does not implement " + TestFile.class.getName());
        }
        try {
            return (TestFile) clazz.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new LoadException("unable to create " + className + ": " + cause, cause);
        }
    }

    private Map<String, byte[]> compile(Path file, String className, String source) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new LoadException("no java compiler available, test files need a JDK runtime");
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);
        MemoryFileManager fileManager = new MemoryFileManager(standard);
        List<String> options = List.of("-classpath", classPath, "-proc:none", "-encoding", "UTF-8");
        List<JavaFileObject> units = List.of(new SourceFile(className, source));
        Boolean success = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
        try {
            fileManager.close();
        } catch (IOException e) {
            logger.warn("failed to close file manager: {}", e.getMessage());
        }
        if (success == null || !success) {
            List<String> errors = new ArrayList<>();
            for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                if (d.getKind() == Diagnostic.Kind.ERROR) {
                    errors.add("line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT));
                }
            }
            throw new LoadException(file + " failed to compile: " + String.join("; ", errors));
        }
        return fileManager.classes;
    }

    /**
     * The jar or directory holding the core classes, plus the class path of
     * this JVM.
     */
    public static String defaultClassPath() {
        List<String> entries = new ArrayList<>();
        try {
            entries.add(Path.of(TestFile.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
        } catch (Exception e) {
            logger.debug("code source of {} not resolvable: {}", TestFile.class.getName(), e.getMessage());
        }
        String jvmPath = System.getProperty("java.class.path");
        if (jvmPath != null && !jvmPath.isEmpty()) {
            entries.add(jvmPath);
        }
        return String.join(File.pathSeparator, entries);
    }

    static class SourceFile extends SimpleJavaFileObject {

        private final String source;

        SourceFile(String className, String source) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }

    }

    static class ClassFile extends SimpleJavaFileObject {

        private final String className;
        private final Map<String, byte[]> target;

        ClassFile(String className, Map<String, byte[]> target) {
            super(URI.create("mem:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
            this.className = className;
            this.target = target;
        }

        @Override
        public OutputStream openOutputStream() {
            return new ByteArrayOutputStream() {
                @Override
                public void close() throws IOException {
                    super.close();
                    target.put(className, toByteArray());
                }
            };
        }

    }

    static class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {

        final Map<String, byte[]> classes = new HashMap<>();

        MemoryFileManager(StandardJavaFileManager fileManager) {
            super(fileManager);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            return new ClassFile(className, classes);
        }

    }

    static class MemoryClassLoader extends ClassLoader {

        private final Map<String, byte[]> classes;

        MemoryClassLoader(Map<String, byte[]> classes, ClassLoader parent) {
            super(parent);
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classes.get(name);
            if (bytes == null) {
                throw new ClassNotFoundException(name);
            }
            return defineClass(name, bytes, 0, bytes.length);
        }

    }

}

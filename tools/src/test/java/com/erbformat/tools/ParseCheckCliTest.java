package com.erbformat.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParseCheckCliTest {

    @TempDir
    Path root;

    private void write(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void reportsOnlyTemplatesThatFailToParse() throws Exception {
        write("app/views/users/show.html.erb", "<h1><%= @user.name %></h1>\n");
        write("app/views/users/edit.html.erb", "<% if a %>\n<p>open\n<% end %>\n");
        write("app/views/layouts/mailer.text.erb", "<%= yield %>\n");
        write("app/views/users/notes.txt", "<div>");
        ByteArrayOutputStream progress = new ByteArrayOutputStream();

        List<ParseCheckCli.Failure> failures =
                ParseCheckCli.check(root, new PrintStream(progress, true, StandardCharsets.UTF_8));

        assertEquals(1, failures.size());
        assertEquals(Path.of("app", "views", "users", "edit.html.erb"), failures.get(0).file());
        assertTrue(failures.get(0).message().contains("<p>"), failures.get(0).message());

        String log = progress.toString(StandardCharsets.UTF_8);
        assertEquals(3, log.lines().filter(line -> line.startsWith("Processing ")).count(), log);
        assertTrue(log.indexOf("layouts") < log.indexOf("users"), "templates are visited in sorted order");
    }

    @Test
    void emptyDirectoryHasNoFailures() throws Exception {
        List<ParseCheckCli.Failure> failures =
                ParseCheckCli.check(root, new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertTrue(failures.isEmpty());
    }
}

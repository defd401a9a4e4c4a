package io.spectr.shell.tasks;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TaskStatusStoreTest {

  private static final String JSONC =
      String.join(
          "\n",
          "// task statuses",
          "{",
          "  \"version\": 2, # revision",
          "  /* nested tasks are flattened */",
          "  \"tasks\": [",
          "    {\"id\": \"1.1\", \"section\": \"Setup\", \"status\": \"completed\"},",
          "    {\"id\": \"1.2\", \"status\": \"in_progress\", \"children\": [",
          "      {\"id\": \"1.2.1\", \"status\": \"done\"}",
          "    ]},",
          "  ]",
          "}");

  @Test
  void readsCommentedJson() throws Exception {
    TaskStatusStore store = TaskStatusStore.parse(JSONC);

    assertEquals(2, store.version());
    assertEquals(List.of("1.1", "1.2", "1.2.1"), List.copyOf(store.statuses().keySet()));
    assertEquals(TaskStatus.COMPLETED, store.status("1.1"));
    assertEquals(TaskStatus.IN_PROGRESS, store.status("1.2"));
    assertNull(store.status("9"));
  }

  @Test
  void unknownStatusIsPending() throws Exception {
    assertEquals(TaskStatus.PENDING, TaskStatusStore.parse(JSONC).status("1.2.1"));
  }

  @Test
  void trailingCommasInObjectsAndArrays() throws Exception {
    TaskStatusStore store =
        TaskStatusStore.parse(
            "{\"version\":1,\"tasks\":[{\"id\":\"1.1\",\"status\":\"completed\",},],}");
    assertEquals(1, store.version());
    assertEquals(TaskStatus.COMPLETED, store.status("1.1"));
  }

  @Test
  void trailingCommaBeforeComment() throws Exception {
    String json =
        String.join(
            "\n",
            "{",
            "  \"tasks\": [",
            "    {\"id\": \"1.1\", \"status\": \"pending\", // last field",
            "     /* closing */ }, # done",
            "  ],",
            "}");
    assertEquals(TaskStatus.PENDING, TaskStatusStore.parse(json).status("1.1"));
  }

  @Test
  void commasInsideStringsAreKept() {
    assertEquals(
        "{\"id\": \"a,}\", \"d\": \"x\\\",]\"}",
        TaskStatusStore.stripTrailingCommas("{\"id\": \"a,}\", \"d\": \"x\\\",]\",}"));
    assertEquals("[1, 2 // a,]\n]", TaskStatusStore.stripTrailingCommas("[1, 2, // a,]\n]"));
  }

  @Test
  void missingTasksIsEmpty() throws Exception {
    TaskStatusStore store = TaskStatusStore.parse("{\"version\": 1}");
    assertTrue(store.statuses().isEmpty());
  }

  @Test
  void statusesAreReadOnly() throws Exception {
    TaskStatusStore store = TaskStatusStore.parse(JSONC);
    assertThrows(
        UnsupportedOperationException.class,
        () -> store.statuses().put("x", TaskStatus.PENDING));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "[]",
        "{ broken",
        "{\"tasks\": {}}",
        "{\"tasks\": [1]}",
        "{\"tasks\": [{\"status\": \"completed\"}]}",
        "{\"version\": \"one\"}"
      })
  void rejectsMalformedFiles(String json) {
    assertThrows(TaskStoreException.class, () -> TaskStatusStore.parse(json));
  }

  @Test
  void readsFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve(TaskSync.STATUS_FILE);
    Files.writeString(file, JSONC);
    assertEquals(3, TaskStatusStore.read(file).statuses().size());
  }

  @Test
  void missingFile(@TempDir Path dir) {
    TaskStoreException e =
        assertThrows(TaskStoreException.class, () -> TaskStatusStore.read(dir.resolve("nope")));
    assertTrue(e.getMessage().contains("nope"));
  }

  @Test
  void statusValues() {
    assertEquals(TaskStatus.IN_PROGRESS, TaskStatus.of("in_progress"));
    assertNull(TaskStatus.of("IN_PROGRESS"));
    assertTrue(TaskStatus.COMPLETED.checked());
    assertFalse(TaskStatus.IN_PROGRESS.checked());
  }
}

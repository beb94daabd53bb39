package ch.tictactoe.tictactoebackend.testutil;

import ch.tictactoe.tictactoebackend.domain.Board;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;

public final class EntityTestUtils {

    private EntityTestUtils() {
        // utility class
    }

    public static void setId(Object entity, UUID id) {
        setField(entity, "id", id);
    }

    public static void setCreatedAt(Object entity, Instant createdAt) {
        setField(entity, "createdAt", createdAt);
    }

    /**
     * Builds a board from a nine-character string like {@code "XO X  O  "}.
     */
    public static Board board(String marks) {
        return Board.fromMarks(marks);
    }

    private static void setField(Object entity, String name, Object value) {
        Class<?> current = entity.getClass();

        while (current != null) {
            try {
                Field field = current.getDeclaredField(name);
                field.setAccessible(true);
                field.set(entity, value);
                return;
            } catch (NoSuchFieldException e) {
                // continue with the superclass
                current = current.getSuperclass();
            } catch (IllegalAccessException e) {
                throw new RuntimeException("Failed to set '" + name + "' via reflection", e);
            }
        }

        throw new IllegalArgumentException("No field '" + name + "' found on class " + entity.getClass());
    }
}

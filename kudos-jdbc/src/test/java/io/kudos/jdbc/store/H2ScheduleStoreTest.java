package io.kudos.jdbc.store;

import io.kudos.DeliveryMethod;
import io.kudos.Schedule;
import io.kudos.crypto.FieldCodec;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2ScheduleStoreTest extends AbstractScheduleStoreIntegrationTest {

    @Override
    AbstractJdbcScheduleStore openStore(FieldCodec codec, Clock clock) {
        return new H2ScheduleStore("jdbc:h2:mem:", codec, clock);
    }

    private static String sharedUrl() {
        return "jdbc:h2:mem:kudos-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    }

    private static String[] rawRow(String url, String id) throws Exception {
        try (Connection conn = DriverManager.getConnection(url);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT recipient, recipient_email, webhook_url, webhook_secret FROM schedules WHERE id='" + id + "'")) {
            assertTrue(rs.next());
            return new String[]{rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)};
        }
    }

    @Test
    void name() {
        assertEquals("h2", store.name());
    }

    @Test
    void sensitiveColumnsAreEncryptedAtRest() throws Exception {
        String url = sharedUrl();
        try (H2ScheduleStore encrypted = new H2ScheduleStore(url, FieldCodec.of("k"), clock)) {
            Schedule schedule = encrypted.createSchedule(draft("alice", 100L)
                    .webhookUrl("https://hooks.example.com/kudos")
                    .webhookSecret("s3cret")
                    .build());

            String[] raw = rawRow(url, schedule.id());
            assertEquals("Ada", raw[0]);
            assertNotEquals("ada@example.com", raw[1]);
            assertNotEquals("https://hooks.example.com/kudos", raw[2]);
            assertNotEquals("s3cret", raw[3]);
            assertEquals("ada@example.com", encrypted.getSchedule(schedule.id()).recipientEmail());
        }
    }

    @Test
    void plaintextCodecStoresValuesAsIs() throws Exception {
        String url = sharedUrl();
        try (H2ScheduleStore plain = new H2ScheduleStore(url, FieldCodec.PLAINTEXT, clock)) {
            Schedule schedule = plain.createSchedule(draft("alice", 100L).build());

            assertEquals("ada@example.com", rawRow(url, schedule.id())[1]);
        }
    }

    @Test
    void legacyPlaintextRowsStayReadableAfterEnablingEncryption() {
        String url = sharedUrl();
        String id;
        try (H2ScheduleStore plain = new H2ScheduleStore(url, FieldCodec.PLAINTEXT, clock)) {
            id = plain.createSchedule(draft("alice", 100L).build()).id();
        }
        try (H2ScheduleStore encrypted = new H2ScheduleStore(url, FieldCodec.of("k"), clock)) {
            assertEquals("ada@example.com", encrypted.getSchedule(id).recipientEmail());
        }
    }

    @Test
    void unknownDeliveryMethodReadsAsEmailWithoutFailingSiblings() throws Exception {
        String url = sharedUrl();
        try (H2ScheduleStore h2 = new H2ScheduleStore(url, FieldCodec.PLAINTEXT, clock)) {
            Schedule corrupt = h2.createSchedule(draft("alice", 100L).build());
            Schedule healthy = h2.createSchedule(draft("alice", 200L).build());
            try (Connection conn = DriverManager.getConnection(url);
                 Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("UPDATE schedules SET delivery_method='sms' WHERE id='" + corrupt.id() + "'");
            }

            List<Schedule> due = h2.getSchedulesDue(200L);

            assertEquals(List.of(corrupt.id(), healthy.id()), ids(due));
            assertEquals(DeliveryMethod.EMAIL, due.get(0).deliveryMethod());
        }
    }

    @Test
    void reopeningExistingDatabaseKeepsRows() {
        String url = sharedUrl();
        String id;
        try (H2ScheduleStore first = new H2ScheduleStore(url, FieldCodec.of("k"), clock)) {
            id = first.createSchedule(draft("alice", 100L).build()).id();
        }
        try (H2ScheduleStore second = new H2ScheduleStore(url, FieldCodec.of("k"), clock)) {
            assertNotNull(second.getSchedule(id));
        }
    }

    @Test
    void privateMemoryDatabasesAreIsolated() {
        store.createSchedule(draft("alice", 100L).build());
        try (H2ScheduleStore other = new H2ScheduleStore("jdbc:h2:mem:", FieldCodec.PLAINTEXT, clock)) {
            assertTrue(other.listSchedules(null).isEmpty());
        }
    }

    @Test
    void closeIsIdempotentAndRejectsFurtherUse() {
        H2ScheduleStore h2 = new H2ScheduleStore("jdbc:h2:mem:", FieldCodec.PLAINTEXT, clock);
        h2.close();
        assertDoesNotThrow(h2::close);
        assertThrows(IllegalStateException.class, () -> h2.isTokenRevoked("jti"));
        assertThrows(IllegalStateException.class, () -> h2.getSchedulesDue(0L));
    }
}

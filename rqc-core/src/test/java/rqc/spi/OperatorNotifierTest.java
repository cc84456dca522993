package rqc.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class OperatorNotifierTest {
  private final Logger logger = Logger.getLogger(OperatorNotifier.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler capture = new Handler() {
    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  };

  @BeforeEach
  void attach() {
    logger.addHandler(capture);
  }

  @AfterEach
  void detach() {
    logger.removeHandler(capture);
  }

  @Test
  void configurationErrorIsLoggedAsSevere() {
    OperatorNotifier.LOGGING.onConfigurationError("J1", "no credentials stored");

    assertEquals(1, records.size());
    LogRecord record = records.get(0);
    assertEquals(Level.SEVERE, record.getLevel());
    assertArrayEquals(new Object[]{"J1", "no credentials stored"}, record.getParameters());
  }
}

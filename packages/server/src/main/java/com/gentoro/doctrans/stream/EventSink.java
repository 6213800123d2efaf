package com.gentoro.doctrans.stream;

import com.gentoro.doctrans.tasks.TaskEvent;
import java.io.IOException;

/**
 * Where the gateway writes events for one observer. An {@link IOException} from either method means
 * the observer went away.
 */
public interface EventSink {
  void send(TaskEvent event) throws IOException;

  void keepalive() throws IOException;
}

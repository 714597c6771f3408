package com.phillippitts.mindscribe.service.delivery;

import com.phillippitts.mindscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Log-only delivery (no OS interactions). */
@Component
class NotifyOnlyTextInserter implements TextInserter {
    private static final Logger LOG = LogManager.getLogger(NotifyOnlyTextInserter.class);

    @Override
    public boolean insert(String text) {
        LOG.info("Transcription ready (chars={})", text == null ? 0 : text.length());
        LOG.debug("Preview: '{}'", LogSanitizer.preview(text, 80));
        return true;
    }

    @Override
    public String name() {
        return "notify";
    }
}

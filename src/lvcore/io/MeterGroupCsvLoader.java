package lvcore.io;

import lvcore.config.MeterType;
import lvcore.model.MeterGroup;
import lvcore.model.MeterGroupFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка групп счётчиков из текстового файла.
 * <p>
 * Формат строки: {@code type;count;capacity}, например {@code C1;35;30}.
 * Пустые строки и строки, начинающиеся с '#', пропускаются. Допускается ',' как разделитель.
 * Id групп присваиваются по порядку с 1. Номинал вне стандартного ряда допускается, но попадает в лог.
 */
public class MeterGroupCsvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MeterGroupCsvLoader.class);

    private final MeterGroupFactory factory;

    public MeterGroupCsvLoader() {
        this(new MeterGroupFactory());
    }

    public MeterGroupCsvLoader(MeterGroupFactory factory) {
        this.factory = factory;
    }

    public List<MeterGroup> load(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(br);
        }
    }

    /**
     * @throws IllegalArgumentException при ошибке формата (с номером строки)
     */
    public List<MeterGroup> load(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<MeterGroup> groups = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            groups.add(parseLine(line, lineNo, groups.size() + 1));
        }
        return groups;
    }

    private MeterGroup parseLine(String line, int lineNo, int groupId) {
        String[] parts = line.split("[;,]");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Line " + lineNo + ": expected 'type;count;capacity', got '" + line + "'");
        }
        try {
            int count = Integer.parseInt(parts[1].trim());
            int capacity = Integer.parseInt(parts[2].trim());
            MeterGroup group = factory.create(groupId, parts[0].trim(), count, capacity);
            if (!MeterType.isStandardCapacity(capacity)) {
                LOG.warn("Line {}: non-standard meter capacity {}A", lineNo, capacity);
            }
            return group;
        } catch (IllegalArgumentException e) {
            // NumberFormatException тоже сюда
            throw new IllegalArgumentException("Line " + lineNo + ": " + e.getMessage(), e);
        }
    }
}

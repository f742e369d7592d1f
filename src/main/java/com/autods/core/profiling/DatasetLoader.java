package com.autods.core.profiling;

import com.autods.core.error.DataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import weka.core.Instances;
import weka.core.converters.AbstractFileLoader;
import weka.core.converters.ArffLoader;
import weka.core.converters.CSVLoader;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a CSV or ARFF file into Weka {@link Instances}. No class index is set here;
 * the target is resolved later.
 */
@Component
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    /**
     * @throws DataException if the file is missing, unreadable or holds no rows
     */
    public Instances load(String location) {
        Path path = Path.of(location);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DataException("Dataset not found or unreadable: " + location);
        }
        log.info("Loading dataset: {}", location);

        Instances data;
        try {
            AbstractFileLoader loader = location.toLowerCase().endsWith(".arff") ? new ArffLoader() : new CSVLoader();
            loader.setSource(new File(location));
            data = loader.getDataSet();
        } catch (Exception e) {
            throw new DataException("Cannot read dataset " + location + ": " + e.getMessage(), e);
        }

        if (data == null || data.numAttributes() == 0 || data.numInstances() == 0) {
            throw new DataException("Dataset is empty: " + location);
        }
        log.info("Loaded {} rows x {} cols", data.numInstances(), data.numAttributes());
        return data;
    }
}

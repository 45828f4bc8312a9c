package com.example.demo.image2excel.config;

import com.example.demo.image2excel.model.GridBounds;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application configuration for image conversion runs.
 *
 * Example application.yml:
 *
 * image2excel:
 *   grid:
 *     max-rows: 1048576
 *     max-columns: 16384
 *   processing:
 *     workers: 0
 *     channel-capacity: 64
 *     channel-bits: 8
 *   reclaim:
 *     threshold: 200000
 *     force-gc: true
 *   output:
 *     directory: ""
 *     sheet-name: Image
 *     column-width: 2
 *     zoom: 10
 *     open-on-finish: true
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "image2excel")
public class ConversionProperties {

    private Grid grid = new Grid();

    private Processing processing = new Processing();

    private Reclaim reclaim = new Reclaim();

    private Output output = new Output();

    public GridBounds gridBounds() {
        return new GridBounds(grid.getMaxRows(), grid.getMaxColumns());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Grid {
        /**
         * Maximum rows of the target worksheet (Excel 2007+: 1,048,576)
         */
        private int maxRows = 1_048_576;

        /**
         * Maximum columns of the target worksheet (Excel 2007+: 16,384, "XFD")
         */
        private int maxColumns = 16_384;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Processing {
        /**
         * Row producer threads. 0 means one per available processor.
         */
        private int workers = 0;

        /**
         * Number of computed rows that may wait for the sink before producers block
         */
        private int channelCapacity = 64;

        /**
         * Bits kept per color channel when truncating into the sink's color encoding (1..8)
         */
        private int channelBits = 8;

        public int effectiveWorkers() {
            return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Reclaim {
        /**
         * Cell writes since the last reclamation that trigger the next one
         */
        private long threshold = 200_000L;

        /**
         * Request a JVM garbage collection on each reclamation pass
         */
        private boolean forceGc = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Output {
        /**
         * Directory for the generated workbook; blank means next to the source image
         */
        private String directory = "";

        private String sheetName = "Image";

        /**
         * Uniform column width, in characters
         */
        private int columnWidth = 2;

        /**
         * Sheet zoom percentage (10..400)
         */
        private int zoom = 10;

        /**
         * Open the saved workbook in the desktop spreadsheet application
         */
        private boolean openOnFinish = true;
    }
}

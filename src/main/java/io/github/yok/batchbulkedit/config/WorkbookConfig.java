package io.github.yok.batchbulkedit.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class for the layout of exported workbooks.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code workbook.header-font-name}, {@code workbook.header-font-size}: header font (bold,
 * black)</li>
 * <li>{@code workbook.header-fill-color}: header background as six hex digits</li>
 * <li>{@code workbook.freeze-header}: keep the header row visible while scrolling</li>
 * <li>{@code workbook.auto-size-columns}: size each column to its longest value</li>
 * <li>{@code workbook.max-column-width}: upper bound in characters for sized columns</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "workbook")
@Getter
@Setter
@NoArgsConstructor
public class WorkbookConfig {

    private String headerFontName = "Arial";

    private short headerFontSize = 10;

    private String headerFillColor = "F2F2F2";

    private boolean freezeHeader = true;

    private boolean autoSizeColumns = true;

    private int maxColumnWidth = 80;
}

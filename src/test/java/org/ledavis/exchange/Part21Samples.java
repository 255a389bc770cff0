package org.ledavis.exchange;

/**
 * 测试用交换文件样本。HEADER 固定占 1-7 行，DATA 段实例从第 {@link #FIRST_DATA_LINE} 行开始，每个参数一行。
 */
public final class Part21Samples {

    public static final int FIRST_DATA_LINE = 8;

    private Part21Samples() {
    }

    public static String file(String... dataLines) {
        return "ISO-10303-21;\n"
                + "HEADER;\n"
                + "FILE_DESCRIPTION(('demo'),'2;1');\n"
                + "FILE_NAME('demo.stp','2024-01-01T00:00:00',('alice'),('acme'),'pre 1.0','cad 2.0','');\n"
                + "FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));\n"
                + "ENDSEC;\n"
                + "DATA;\n"
                + (dataLines.length == 0 ? "" : String.join("\n", dataLines) + "\n")
                + "ENDSEC;\n"
                + "END-ISO-10303-21;\n";
    }
}

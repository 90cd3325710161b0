package creational.factory.document;

public class ExcelDocument implements Document {

    @Override
    public String export() {
        return "Exporting Excel document";
    }
}

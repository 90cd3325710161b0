package creational.factory.document;

public class PdfDocument implements Document {

    @Override
    public String export() {
        return "Exporting PDF document";
    }
}

package creational.factory.document;

public class WordDocument implements Document {

    @Override
    public String export() {
        return "Exporting Word document";
    }
}
